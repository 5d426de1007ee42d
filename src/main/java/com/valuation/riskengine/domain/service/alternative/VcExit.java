package com.valuation.riskengine.domain.service.alternative;

import com.valuation.riskengine.domain.model.RelativeMethod;

/**
 * Exit case for the plain venture capital method. With an
 * {@code exitMultiple} the exit value is recomputed from the company's
 * grown net income (PE) or revenue (PS); otherwise {@code exitValuation} is
 * taken as given. Null fields fall back to the configured defaults.
 */
public record VcExit(Double exitValuation,
                     Double targetReturnMultiple,
                     Integer investmentYears,
                     RelativeMethod exitMethod,
                     Double exitMultiple) {
}
