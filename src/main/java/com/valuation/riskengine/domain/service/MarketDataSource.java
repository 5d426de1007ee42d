package com.valuation.riskengine.domain.service;

import com.valuation.riskengine.domain.model.ComparableCompany;

import java.util.List;
import java.util.Optional;

/**
 * Source of peer companies and listed-company fundamentals. Implementations
 * return multiples they cannot obtain as null and never invent them.
 */
public interface MarketDataSource {

    List<ComparableCompany> findComparables(String industry, int limit);

    Optional<ComparableCompany> findCompany(String tsCode);
}
