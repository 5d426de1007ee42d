package com.valuation.riskengine.domain.model;

/**
 * Dispersion of one multiple across the usable comparables. Statistics are
 * NaN when {@code count} is zero.
 */
public record MultipleStatistics(
        RelativeMethod method,
        int count,
        double mean,
        double median,
        double std,
        double min,
        double max
) {}
