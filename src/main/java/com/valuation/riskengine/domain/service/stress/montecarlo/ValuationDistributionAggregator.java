package com.valuation.riskengine.domain.service.stress.montecarlo;

import com.valuation.riskengine.domain.model.MonteCarloResult;
import com.valuation.riskengine.domain.model.MonteCarloResult.HistogramBin;
import com.valuation.riskengine.domain.service.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns raw simulated values into a {@link MonteCarloResult}. NaN entries
 * mark iterations without a valid valuation and are excluded.
 */
@Component
public class ValuationDistributionAggregator {

    public MonteCarloResult aggregate(double[] simulated, Long seed, int bins,
                                      List<String> warnings, long calcDurationMicros) {
        double[] valid = Arrays.stream(simulated).filter(Double::isFinite).toArray();
        int invalid = simulated.length - valid.length;

        List<String> allWarnings = new ArrayList<>(warnings);
        if (valid.length == 0) {
            allWarnings.add("no valid iterations: all " + simulated.length
                    + " samples produced a degenerate valuation");
            return MonteCarloResult.builder()
                    .iterations(simulated.length)
                    .validIterations(0)
                    .seed(seed)
                    .mean(Double.NaN).median(Double.NaN).std(Double.NaN)
                    .minValue(Double.NaN).maxValue(Double.NaN)
                    .percentile5(Double.NaN).percentile10(Double.NaN).percentile25(Double.NaN)
                    .percentile75(Double.NaN).percentile90(Double.NaN).percentile95(Double.NaN)
                    .histogram(List.of())
                    .warnings(List.copyOf(allWarnings))
                    .calcDurationMicros(calcDurationMicros)
                    .build();
        }
        if (invalid > 0) {
            allWarnings.add(invalid + " of " + simulated.length
                    + " iterations skipped: degenerate valuation");
        }

        double mean = DescriptiveStatistics.mean(valid);
        double std = DescriptiveStatistics.populationStd(valid, mean);
        Arrays.sort(valid);

        return MonteCarloResult.builder()
                .iterations(simulated.length)
                .validIterations(valid.length)
                .seed(seed)
                .mean(mean)
                .median(DescriptiveStatistics.median(valid))
                .std(std)
                .minValue(valid[0])
                .maxValue(valid[valid.length - 1])
                .percentile5(DescriptiveStatistics.percentile(valid, 5))
                .percentile10(DescriptiveStatistics.percentile(valid, 10))
                .percentile25(DescriptiveStatistics.percentile(valid, 25))
                .percentile75(DescriptiveStatistics.percentile(valid, 75))
                .percentile90(DescriptiveStatistics.percentile(valid, 90))
                .percentile95(DescriptiveStatistics.percentile(valid, 95))
                .histogram(histogram(valid, bins))
                .warnings(List.copyOf(allWarnings))
                .calcDurationMicros(calcDurationMicros)
                .build();
    }

    /**
     * Equal-width bins over [min, max] of the sorted values; the last bin is
     * closed on the right. A constant sample gets the unit-wide range
     * [v - 0.5, v + 0.5].
     */
    List<HistogramBin> histogram(double[] sorted, int bins) {
        double lo = sorted[0];
        double hi = sorted[sorted.length - 1];
        if (lo == hi) {
            lo -= 0.5;
            hi += 0.5;
        }
        double width = (hi - lo) / bins;

        int[] counts = new int[bins];
        for (double v : sorted) {
            int index = (int) ((v - lo) / width);
            counts[Math.min(Math.max(index, 0), bins - 1)]++;
        }

        List<HistogramBin> histogram = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            double lower = lo + i * width;
            double upper = i == bins - 1 ? hi : lo + (i + 1) * width;
            histogram.add(new HistogramBin(lower, upper, counts[i]));
        }
        return List.copyOf(histogram);
    }
}
