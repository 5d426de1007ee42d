package com.valuation.riskengine.domain.service.stress.montecarlo;

/**
 * DCF inputs perturbed per iteration, with the domain each sample is
 * clamped into.
 */
public enum SampledParameter {
    GROWTH_RATE(-0.9, 3.0),
    OPERATING_MARGIN(0.0, 0.99),
    WACC(0.001, 1.0),
    TERMINAL_GROWTH_RATE(-0.05, 0.10);

    private final double min;
    private final double max;

    SampledParameter(double min, double max) {
        this.min = min;
        this.max = max;
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }
}
