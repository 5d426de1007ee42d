package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Empirical distribution of simulated equity values. When no iteration
 * produced a valid valuation the statistics are NaN, the histogram is empty
 * and {@code warnings} says why.
 */
@Getter
@Builder
public class MonteCarloResult {

    private final int iterations;
    private final int validIterations;
    private final Long seed;

    private final double mean;
    private final double median;
    private final double std;
    private final double minValue;
    private final double maxValue;

    private final double percentile5;
    private final double percentile10;
    private final double percentile25;
    private final double percentile75;
    private final double percentile90;
    private final double percentile95;

    private final List<HistogramBin> histogram;
    private final List<String> warnings;
    private final long calcDurationMicros;

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }

    public record HistogramBin(double binLower, double binUpper, int count) {}
}
