package com.valuation.riskengine.domain.service;

import java.util.Arrays;
import java.util.Collection;

/**
 * Summary statistics over plain double samples. Standard deviation is the
 * population one (divisor n). Percentiles interpolate linearly between
 * closest ranks, so the median of an even-sized sample is the mean of the
 * two middle values.
 */
public final class DescriptiveStatistics {

    private DescriptiveStatistics() {
    }

    public static double[] sortedCopy(Collection<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        return sorted;
    }

    public static double mean(double[] values) {
        if (values.length == 0) return Double.NaN;
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double populationStd(double[] values, double mean) {
        if (values.length == 0) return Double.NaN;
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    public static double median(double[] sorted) {
        return percentile(sorted, 50);
    }

    /** {@code sorted} must be in ascending order. */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) return Double.NaN;
        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = index - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
