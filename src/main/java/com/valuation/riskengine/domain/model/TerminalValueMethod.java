package com.valuation.riskengine.domain.model;

public enum TerminalValueMethod {
    PERPETUITY_GROWTH,
    EXIT_MULTIPLE
}
