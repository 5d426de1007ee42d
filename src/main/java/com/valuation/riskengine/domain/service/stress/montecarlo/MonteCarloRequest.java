package com.valuation.riskengine.domain.service.stress.montecarlo;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * One simulation run. A parameter missing from {@code distributions} is held
 * at its base value. A null seed draws a fresh one, reported back in the
 * result.
 */
@Getter
@Builder(toBuilder = true)
public class MonteCarloRequest {

    private final Long seed;

    @Builder.Default
    private final int iterations = 1_000;

    @Builder.Default
    private final int histogramBins = 30;

    @Builder.Default
    private final Map<SampledParameter, ParameterDistribution> distributions = Map.of();
}
