package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ScenarioStatistics {

    private final int count;
    private final double mean;
    private final double median;
    private final double std;
    private final double min;
    private final double max;
    private final double range;
}
