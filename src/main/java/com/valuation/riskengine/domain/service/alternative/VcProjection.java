package com.valuation.riskengine.domain.service.alternative;

import com.valuation.riskengine.domain.service.InvalidInputException;

/**
 * Exit assumptions for the projected venture capital method: net income
 * compounds at the company growth rate (and the optional yearly margin
 * improvement) for {@code projectionYears}, is capitalised at
 * {@code targetPe} and discounted by the target return multiple.
 */
public record VcProjection(int projectionYears, double targetPe, double targetReturnMultiple,
                           double marginImprovement) {

    public VcProjection {
        if (projectionYears < 1) {
            throw new InvalidInputException("projectionYears", "projectionYears must be >= 1, got " + projectionYears);
        }
        if (!(targetPe > 0) || !Double.isFinite(targetPe)) {
            throw new InvalidInputException("targetPe", "targetPe must be > 0, got " + targetPe);
        }
        if (!(targetReturnMultiple > 0) || !Double.isFinite(targetReturnMultiple)) {
            throw new InvalidInputException("targetReturnMultiple",
                    "targetReturnMultiple must be > 0, got " + targetReturnMultiple);
        }
        if (!(marginImprovement >= 0) || !Double.isFinite(marginImprovement)) {
            throw new InvalidInputException("marginImprovement",
                    "marginImprovement must be >= 0, got " + marginImprovement);
        }
    }
}
