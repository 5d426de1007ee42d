package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class StressReport {

    private final String companyName;
    private final double baseValue;
    private final List<StressTestResult> revenueShock;
    private final List<StressTestResult> marginCompression;
    private final List<StressTestResult> waccShock;
    private final List<StressTestResult> growthSlowdown;
    private final StressTestResult extremeCrash;
    private final MonteCarloResult monteCarlo;

    /** Most negative change across all discrete tests, 0 when nothing lost value. */
    private final double maxDownside;
}
