package com.valuation.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Named bundle of signed, additive adjustments applied to the base company
 * before a DCF evaluation. All deltas default to zero.
 */
@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScenarioConfig {

    private final String name;
    private final double revenueGrowthAdj;
    private final double marginAdj;
    private final double waccAdj;
    private final double terminalGrowthAdj;

    public static ScenarioConfig base() {
        return ScenarioConfig.builder().name("base").build();
    }
}
