package com.valuation.riskengine.domain.service.stress.montecarlo;

import com.valuation.riskengine.domain.service.InvalidInputException;

import java.util.SplittableRandom;

/**
 * Perturbation added to a parameter's base value. {@code spread} is the
 * standard deviation for NORMAL and the half-width for UNIFORM.
 */
public record ParameterDistribution(DistributionType type, double mean, double spread) {

    public ParameterDistribution {
        if (type == null) {
            type = DistributionType.NORMAL;
        }
        if (!Double.isFinite(mean)) {
            throw new InvalidInputException("distribution.mean", "distribution mean must be finite");
        }
        if (!(spread >= 0) || !Double.isFinite(spread)) {
            throw new InvalidInputException("distribution.spread",
                    "distribution spread must be a finite value >= 0, got " + spread);
        }
    }

    public static ParameterDistribution normal(double std) {
        return new ParameterDistribution(DistributionType.NORMAL, 0.0, std);
    }

    public double sample(SplittableRandom rng) {
        return switch (type) {
            case NORMAL -> mean + spread * rng.nextGaussian();
            case UNIFORM -> mean + spread * (2.0 * rng.nextDouble() - 1.0);
        };
    }
}
