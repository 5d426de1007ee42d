package com.valuation.riskengine.domain.service.alternative;

/** One segment of a sum-of-the-parts valuation: a direct value, or revenue times a multiple. */
public record BusinessUnit(String name, Double revenue, Double multiple, Double value) {
}
