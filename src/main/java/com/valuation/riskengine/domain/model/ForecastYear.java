package com.valuation.riskengine.domain.model;

/**
 * One explicit-period year of a cash-flow forecast. Reinvestment components
 * are expressed in the same currency unit as revenue.
 */
public record ForecastYear(
        int year,
        double revenue,
        double growthRate,
        double operatingProfit,
        double nopat,
        double depreciation,
        double capex,
        double workingCapitalChange,
        double fcf
) {}
