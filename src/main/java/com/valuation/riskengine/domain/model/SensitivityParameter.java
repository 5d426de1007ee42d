package com.valuation.riskengine.domain.model;

import java.util.List;

/**
 * DCF inputs that can be swept. Rates are absolute fractions; REVENUE is the
 * base-year revenue level.
 */
public enum SensitivityParameter {
    GROWTH_RATE,
    OPERATING_MARGIN,
    WACC,
    TERMINAL_GROWTH_RATE,
    TAX_RATE,
    REVENUE;

    /** Tornado parameters, in tie-break order. */
    public static final List<SensitivityParameter> STANDARD =
            List.of(GROWTH_RATE, OPERATING_MARGIN, WACC, TERMINAL_GROWTH_RATE);
}
