package com.valuation.riskengine.domain.service.dcf;

import com.valuation.riskengine.domain.model.TerminalValueMethod;
import com.valuation.riskengine.domain.service.InvalidInputException;

/**
 * Model-level assumptions for one DCF call. Reinvestment ratios are
 * fractions of each forecast year's revenue.
 */
public record DcfAssumptions(
        int horizonYears,
        double capexRatio,
        double workingCapitalRatio,
        double depreciationRatio,
        double minWaccSpread,
        double exitMultiple,
        TerminalValueMethod terminalMethod
) {

    public static final int MAX_HORIZON_YEARS = 30;

    public DcfAssumptions {
        if (horizonYears < 1 || horizonYears > MAX_HORIZON_YEARS) {
            throw new InvalidInputException("horizonYears",
                    "horizonYears must be in [1, " + MAX_HORIZON_YEARS + "], got " + horizonYears);
        }
        if (terminalMethod == null) {
            terminalMethod = TerminalValueMethod.PERPETUITY_GROWTH;
        }
        if (minWaccSpread < 0) {
            throw new InvalidInputException("minWaccSpread", "minWaccSpread must be >= 0");
        }
        if (terminalMethod == TerminalValueMethod.EXIT_MULTIPLE && !(exitMultiple > 0)) {
            throw new InvalidInputException("exitMultiple", "exitMultiple must be > 0");
        }
    }

    public static DcfAssumptions defaults() {
        return new DcfProperties().toAssumptions();
    }

    public double netReinvestmentRatio() {
        return capexRatio + workingCapitalRatio - depreciationRatio;
    }

    public DcfAssumptions withHorizon(int years) {
        return new DcfAssumptions(years, capexRatio, workingCapitalRatio, depreciationRatio,
                minWaccSpread, exitMultiple, terminalMethod);
    }

    public DcfAssumptions withTerminalMethod(TerminalValueMethod method) {
        return new DcfAssumptions(horizonYears, capexRatio, workingCapitalRatio, depreciationRatio,
                minWaccSpread, exitMultiple, method);
    }
}
