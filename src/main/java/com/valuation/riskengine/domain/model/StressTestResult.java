package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
public class StressTestResult {

    private final String testName;
    private final String scenarioDescription;
    private final double baseValue;
    private final double stressedValue;
    private final double changePct;
    private final Map<String, Object> details;

    public double getDownsideProtection() {
        return Math.min(0.0, changePct);
    }
}
