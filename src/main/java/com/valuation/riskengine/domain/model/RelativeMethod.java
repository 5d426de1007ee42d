package com.valuation.riskengine.domain.model;

/**
 * Multiple-based valuation methods. The declaration order is the order in
 * which results are reported.
 */
public enum RelativeMethod {
    PE("P/E"),
    PS("P/S"),
    PB("P/B"),
    EV_EBITDA("EV/EBITDA");

    private final String label;

    RelativeMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
