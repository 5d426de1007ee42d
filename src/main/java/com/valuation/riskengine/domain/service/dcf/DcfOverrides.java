package com.valuation.riskengine.domain.service.dcf;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.SensitivityParameter;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-call parameter overrides. Every field is optional; null keeps the
 * company's own value. {@code wacc} replaces the CAPM-derived rate,
 * {@code waccAdjustment} is added on top of whichever rate is used.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
public class DcfOverrides {

    public static final DcfOverrides NONE = DcfOverrides.builder().build();

    private final Double revenue;
    private final Double growthRate;
    private final Double operatingMargin;
    private final Double taxRate;
    private final Double terminalGrowthRate;
    private final Double wacc;
    private final Double waccAdjustment;

    /** Derived copy of the company with the company-level overrides applied. */
    public Company applyTo(Company company) {
        if (revenue == null && growthRate == null && operatingMargin == null
                && taxRate == null && terminalGrowthRate == null) {
            return company;
        }
        Company.CompanyBuilder builder = company.toBuilder();
        if (revenue != null) builder.revenue(revenue);
        if (growthRate != null) builder.growthRate(growthRate);
        if (operatingMargin != null) builder.operatingMargin(operatingMargin);
        if (taxRate != null) builder.taxRate(taxRate);
        if (terminalGrowthRate != null) builder.terminalGrowthRate(terminalGrowthRate);
        return builder.build();
    }

    /** Copy of these overrides with one parameter replaced by an absolute value. */
    public DcfOverrides with(SensitivityParameter parameter, double value) {
        DcfOverridesBuilder builder = toBuilder();
        switch (parameter) {
            case GROWTH_RATE -> builder.growthRate(value);
            case OPERATING_MARGIN -> builder.operatingMargin(value);
            case WACC -> builder.wacc(value);
            case TERMINAL_GROWTH_RATE -> builder.terminalGrowthRate(value);
            case TAX_RATE -> builder.taxRate(value);
            case REVENUE -> builder.revenue(value);
        }
        return builder.build();
    }
}
