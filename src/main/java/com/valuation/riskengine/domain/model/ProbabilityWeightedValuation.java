package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Expected equity value over probability-weighted scenarios. Probabilities
 * are normalised by their total, so they need not sum to one.
 */
@Getter
@Builder
public class ProbabilityWeightedValuation {

    private final double expectedValue;
    private final double totalProbability;
    private final List<WeightedOutcome> outcomes;

    public record WeightedOutcome(String name, double probability, double normalisedProbability, double value) {}
}
