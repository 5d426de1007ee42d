package com.valuation.riskengine.domain.service;

/**
 * Base of every failure the engine reports on purpose. Unchecked: callers
 * at the HTTP boundary translate it, analyses that tolerate partial failure
 * catch it per sub-step.
 */
public abstract class ValuationException extends RuntimeException {

    private final String field;

    protected ValuationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /** Offending input field or model parameter. */
    public String getField() {
        return field;
    }
}
