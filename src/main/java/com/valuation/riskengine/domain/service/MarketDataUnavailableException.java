package com.valuation.riskengine.domain.service;

/**
 * A market data source could not be reached or answered with an error.
 * Not a {@link ValuationException}: the input was fine, the collaborator
 * was not.
 */
public class MarketDataUnavailableException extends RuntimeException {

    public MarketDataUnavailableException(String message) {
        super(message);
    }
}
