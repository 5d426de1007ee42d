package com.valuation.riskengine.domain.model;

public record ScenarioOutcome(ScenarioConfig scenario, ValuationResult valuation) {

    public double value() {
        return valuation.getValue();
    }
}
