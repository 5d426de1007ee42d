package com.valuation.riskengine.domain.service;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ComparableCompany;

import java.util.List;

/**
 * Rejects inputs before any computation. Balance-sheet amounts that are
 * legitimately negative (net income, net assets, EBITDA) are only checked
 * for finiteness.
 */
public final class CompanyValidator {

    private CompanyValidator() {
    }

    public static Company validate(Company company) {
        if (company == null) {
            throw new InvalidInputException("company", "company is required");
        }
        if (company.getIndustry() == null || company.getIndustry().isBlank()) {
            throw new InvalidInputException("industry", "industry is required");
        }
        if (company.getStage() == null) {
            throw new InvalidInputException("stage", "development stage is required");
        }
        requirePresent("revenue", company.getRevenue());
        requirePresent("netIncome", company.getNetIncome());

        requireNonNegative("revenue", company.getRevenue());
        requireNonNegative("totalDebt", company.getTotalDebt());
        requireNonNegative("cashAndEquivalents", company.getCashAndEquivalents());

        requireFinite("netIncome", company.getNetIncome());
        if (company.getNetAssets() != null) requireFinite("netAssets", company.getNetAssets());
        if (company.getEbitda() != null) requireFinite("ebitda", company.getEbitda());

        if (!(company.getTaxRate() >= 0.0 && company.getTaxRate() < 1.0)) {
            throw new InvalidInputException("taxRate",
                    "taxRate must be in [0, 1), got " + company.getTaxRate());
        }
        if (!(company.getTargetDebtRatio() >= 0.0 && company.getTargetDebtRatio() <= 1.0)) {
            throw new InvalidInputException("targetDebtRatio",
                    "targetDebtRatio must be in [0, 1], got " + company.getTargetDebtRatio());
        }
        if (company.getOperatingMargin() != null) {
            double margin = company.getOperatingMargin();
            if (!(margin > -1.0 && margin < 1.0)) {
                throw new InvalidInputException("operatingMargin",
                        "operatingMargin must be a fraction in (-1, 1), got " + margin);
            }
        }
        requireRate("growthRate", company.getGrowthRate());
        requireRate("terminalGrowthRate", company.getTerminalGrowthRate());
        requireFinite("beta", company.getBeta());
        requireFinite("riskFreeRate", company.getRiskFreeRate());
        requireFinite("marketRiskPremium", company.getMarketRiskPremium());
        requireNonNegative("costOfDebt", company.getCostOfDebt());
        return company;
    }

    public static void validateComparables(List<ComparableCompany> comparables) {
        if (comparables == null) {
            throw new InvalidInputException("comparables", "comparables list is required");
        }
        for (int i = 0; i < comparables.size(); i++) {
            if (comparables.get(i) == null) {
                throw new InvalidInputException("comparables[" + i + "]", "comparable entry is null");
            }
        }
    }

    private static void requirePresent(String field, Double value) {
        if (value == null) {
            throw new InvalidInputException(field, field + " is required");
        }
    }

    private static void requireNonNegative(String field, double value) {
        requireFinite(field, value);
        if (value < 0) {
            throw new InvalidInputException(field, field + " must be >= 0, got " + value);
        }
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(field, field + " must be a finite number");
        }
    }

    // percentages slip in as 15 instead of 0.15
    private static void requireRate(String field, double value) {
        requireFinite(field, value);
        if (value <= -1.0 || value > 10.0) {
            throw new InvalidInputException(field,
                    field + " must be a fraction (0.15 = 15%), got " + value);
        }
    }
}
