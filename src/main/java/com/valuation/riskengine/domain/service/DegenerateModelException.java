package com.valuation.riskengine.domain.service;

/**
 * The inputs are well-formed but the model has no finite answer, e.g. WACC
 * not above terminal growth or a zero multiple denominator.
 */
public class DegenerateModelException extends ValuationException {

    public DegenerateModelException(String parameter, String message) {
        super(parameter, message);
    }
}
