package com.valuation.riskengine.domain.service;

public class InvalidInputException extends ValuationException {

    public InvalidInputException(String field, String message) {
        super(field, message);
    }
}
