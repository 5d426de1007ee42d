package com.valuation.riskengine.domain.model;

public record TornadoEntry(
        SensitivityParameter parameter,
        double lowParameterValue,
        double highParameterValue,
        Double valueAtLow,
        Double valueAtHigh,
        double valuationRange,
        double impactPercentage
) {}
