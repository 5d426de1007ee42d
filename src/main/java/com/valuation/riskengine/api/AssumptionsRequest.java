package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.TerminalValueMethod;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;

/**
 * Optional per-request DCF overrides. Absent fields keep the configured
 * defaults.
 */
public record AssumptionsRequest(
        Integer horizonYears,
        TerminalValueMethod terminalMethod,
        Double exitMultiple
) {

    static DcfAssumptions resolve(AssumptionsRequest request, DcfAssumptions defaults) {
        if (request == null) return defaults;
        return new DcfAssumptions(
                request.horizonYears() != null ? request.horizonYears() : defaults.horizonYears(),
                defaults.capexRatio(),
                defaults.workingCapitalRatio(),
                defaults.depreciationRatio(),
                defaults.minWaccSpread(),
                request.exitMultiple() != null ? request.exitMultiple() : defaults.exitMultiple(),
                request.terminalMethod() != null ? request.terminalMethod() : defaults.terminalMethod());
    }
}
