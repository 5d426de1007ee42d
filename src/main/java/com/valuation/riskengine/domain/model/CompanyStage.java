package com.valuation.riskengine.domain.model;

public enum CompanyStage {
    EARLY,
    GROWTH,
    MATURE,
    LISTED
}
