package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Result of sweeping one parameter. {@code valuations} is aligned with
 * {@code parameterValues}; a null entry marks a degenerate sweep point.
 * {@code baseValue} is the unswept DCF equity value.
 */
@Getter
@Builder
public class OneWaySensitivity {

    private final SensitivityParameter parameter;
    private final double baseParameterValue;
    private final List<Double> parameterValues;
    private final List<Double> valuations;
    private final Double minValuation;
    private final Double maxValuation;
    private final double valuationRange;
    private final double baseValue;
    private final double impactPercentage;
    private final Double elasticity;
}
