package com.valuation.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Subject company of a valuation. Instances are immutable; analyses derive
 * overridden copies through {@link #toBuilder()} instead of mutating.
 *
 * <p>Rates are fractions (0.15 = 15%). {@code revenue}, {@code netIncome},
 * {@code industry} and {@code stage} are required; every other field has a
 * documented default or is optional (nullable).
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Company {

    public static final double DEFAULT_OPERATING_MARGIN = 0.20;

    private final String name;
    private final String industry;
    private final CompanyStage stage;

    private final Double revenue;
    private final Double netIncome;
    private final Double netAssets;
    private final Double ebitda;

    @Builder.Default
    private final double totalDebt = 0.0;

    @Builder.Default
    private final double cashAndEquivalents = 0.0;

    @Builder.Default
    private final double growthRate = 0.15;

    /** Null means unknown; DCF then assumes {@link #DEFAULT_OPERATING_MARGIN}. */
    private final Double operatingMargin;

    @Builder.Default
    private final double taxRate = 0.25;

    @Builder.Default
    private final double beta = 1.0;

    @Builder.Default
    private final double riskFreeRate = 0.03;

    @Builder.Default
    private final double marketRiskPremium = 0.07;

    @Builder.Default
    private final double costOfDebt = 0.05;

    @Builder.Default
    private final double targetDebtRatio = 0.3;

    @Builder.Default
    private final double terminalGrowthRate = 0.025;

    public double getNetDebt() {
        return totalDebt - cashAndEquivalents;
    }

    public double resolvedOperatingMargin() {
        return operatingMargin != null ? operatingMargin : DEFAULT_OPERATING_MARGIN;
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : industry + "/" + stage;
    }
}
