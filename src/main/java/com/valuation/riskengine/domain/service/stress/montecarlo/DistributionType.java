package com.valuation.riskengine.domain.service.stress.montecarlo;

public enum DistributionType {
    NORMAL,
    UNIFORM
}
