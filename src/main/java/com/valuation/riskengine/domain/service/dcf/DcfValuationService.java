package com.valuation.riskengine.domain.service.dcf;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ForecastYear;
import com.valuation.riskengine.domain.model.SensitivityParameter;
import com.valuation.riskengine.domain.model.TerminalValueMethod;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.DegenerateModelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discounted-cash-flow kernel. Every scenario, stress and sensitivity
 * analysis is a series of calls to {@link #dcfValuation}; the service keeps
 * no state between calls.
 *
 * <p>Revenue growth decays linearly from the company's growth rate in year 1
 * to its terminal growth rate in the final forecast year. Cash flows are
 * discounted with factor {@code 1/(1+wacc)^t}, t starting at 1.
 */
@Slf4j
@Service
public class DcfValuationService {

    public static final String METHOD = "DCF";

    public static final String DETAIL_WACC = "wacc";
    public static final String DETAIL_PV_FORECASTS = "pvForecasts";
    public static final String DETAIL_PV_TERMINAL = "pvTerminal";
    public static final String DETAIL_TERMINAL_VALUE = "terminalValue";
    public static final String DETAIL_ENTERPRISE_VALUE = "enterpriseValue";
    public static final String DETAIL_NET_DEBT = "netDebt";
    public static final String DETAIL_FORECASTS = "forecasts";

    private final DcfAssumptions defaultAssumptions;

    public DcfValuationService(DcfProperties properties) {
        this.defaultAssumptions = properties.toAssumptions();
    }

    public DcfAssumptions defaultAssumptions() {
        return defaultAssumptions;
    }

    /**
     * CAPM cost of equity blended with after-tax cost of debt at the target
     * debt ratio.
     */
    public double calculateWacc(Company company) {
        double costOfEquity = company.getRiskFreeRate() + company.getBeta() * company.getMarketRiskPremium();
        double costOfDebtAfterTax = company.getCostOfDebt() * (1 - company.getTaxRate());
        double debtRatio = company.getTargetDebtRatio();
        return costOfEquity * (1 - debtRatio) + costOfDebtAfterTax * debtRatio;
    }

    public List<ForecastYear> forecastFreeCashFlows(Company company, DcfAssumptions assumptions) {
        int horizon = assumptions.horizonYears();
        double startGrowth = company.getGrowthRate();
        double endGrowth = company.getTerminalGrowthRate();
        double margin = company.resolvedOperatingMargin();
        double taxRate = company.getTaxRate();

        List<ForecastYear> forecasts = new ArrayList<>(horizon);
        double revenue = company.getRevenue();
        for (int year = 1; year <= horizon; year++) {
            double growth = decayedGrowth(startGrowth, endGrowth, year, horizon);
            revenue = revenue * (1 + growth);

            double operatingProfit = revenue * margin;
            double nopat = operatingProfit * (1 - taxRate);
            double depreciation = revenue * assumptions.depreciationRatio();
            double capex = revenue * assumptions.capexRatio();
            double workingCapitalChange = revenue * assumptions.workingCapitalRatio();
            double fcf = nopat + depreciation - capex - workingCapitalChange;

            forecasts.add(new ForecastYear(year, revenue, growth, operatingProfit, nopat,
                    depreciation, capex, workingCapitalChange, fcf));
        }
        return List.copyOf(forecasts);
    }

    static double decayedGrowth(double startGrowth, double endGrowth, int year, int horizon) {
        if (horizon <= 1) {
            return startGrowth;
        }
        double progress = (double) (year - 1) / (horizon - 1);
        return startGrowth + (endGrowth - startGrowth) * progress;
    }

    /**
     * Value at the end of the forecast horizon of every later cash flow.
     *
     * @throws DegenerateModelException when the perpetuity would diverge
     */
    public double calculateTerminalValue(double terminalFcf,
                                         double wacc,
                                         double terminalGrowthRate,
                                         DcfAssumptions assumptions) {
        if (assumptions.terminalMethod() == TerminalValueMethod.EXIT_MULTIPLE) {
            return terminalFcf * assumptions.exitMultiple();
        }
        requireSpread(wacc, terminalGrowthRate, assumptions.minWaccSpread());
        return terminalFcf * (1 + terminalGrowthRate) / (wacc - terminalGrowthRate);
    }

    public ValuationResult dcfValuation(Company company) {
        return dcfValuation(company, DcfOverrides.NONE, defaultAssumptions);
    }

    public ValuationResult dcfValuation(Company company, DcfOverrides overrides) {
        return dcfValuation(company, overrides, defaultAssumptions);
    }

    public ValuationResult dcfValuation(Company company, DcfOverrides overrides, DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        DcfOverrides effectiveOverrides = overrides != null ? overrides : DcfOverrides.NONE;
        Company effective = effectiveOverrides == DcfOverrides.NONE
                ? company
                : CompanyValidator.validate(effectiveOverrides.applyTo(company));

        double wacc = effectiveOverrides.getWacc() != null
                ? effectiveOverrides.getWacc()
                : calculateWacc(effective);
        if (effectiveOverrides.getWaccAdjustment() != null) {
            wacc += effectiveOverrides.getWaccAdjustment();
        }
        if (!Double.isFinite(wacc) || wacc <= -1.0) {
            throw new DegenerateModelException("wacc", "wacc must be a finite rate above -100%, got " + wacc);
        }
        double terminalGrowth = effective.getTerminalGrowthRate();
        if (assumptions.terminalMethod() == TerminalValueMethod.PERPETUITY_GROWTH) {
            requireSpread(wacc, terminalGrowth, assumptions.minWaccSpread());
        }

        List<ForecastYear> forecasts = forecastFreeCashFlows(effective, assumptions);

        double pvForecasts = 0.0;
        for (ForecastYear forecast : forecasts) {
            pvForecasts += forecast.fcf() / Math.pow(1 + wacc, forecast.year());
        }

        ForecastYear last = forecasts.get(forecasts.size() - 1);
        double terminalValue = calculateTerminalValue(last.fcf(), wacc, terminalGrowth, assumptions);
        double pvTerminal = terminalValue / Math.pow(1 + wacc, assumptions.horizonYears());

        double enterpriseValue = pvForecasts + pvTerminal;
        double netDebt = effective.getNetDebt();
        double equityValue = enterpriseValue - netDebt;

        if (!Double.isFinite(equityValue)) {
            throw new DegenerateModelException("wacc",
                    "DCF produced a non-finite value: wacc=" + wacc + ", terminalGrowth=" + terminalGrowth);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(DETAIL_WACC, wacc);
        details.put("horizonYears", assumptions.horizonYears());
        details.put("terminalGrowthRate", terminalGrowth);
        details.put("terminalMethod", assumptions.terminalMethod());
        details.put(DETAIL_PV_FORECASTS, pvForecasts);
        details.put(DETAIL_PV_TERMINAL, pvTerminal);
        details.put(DETAIL_TERMINAL_VALUE, terminalValue);
        details.put(DETAIL_ENTERPRISE_VALUE, enterpriseValue);
        details.put(DETAIL_NET_DEBT, netDebt);
        details.put(DETAIL_FORECASTS, forecasts);

        Map<String, Object> used = new LinkedHashMap<>();
        used.put("growthRate", effective.getGrowthRate());
        used.put("operatingMargin", effective.resolvedOperatingMargin());
        used.put("taxRate", effective.getTaxRate());
        used.put("capexRatio", assumptions.capexRatio());
        used.put("workingCapitalRatio", assumptions.workingCapitalRatio());
        used.put("depreciationRatio", assumptions.depreciationRatio());

        log.debug("[DCF] valuation done: company={}, wacc={}, g={}, tg={}, pvFcf={}, pvTv={}, equity={}",
                effective.displayName(), String.format("%.4f", wacc),
                String.format("%.4f", effective.getGrowthRate()), String.format("%.4f", terminalGrowth),
                String.format("%.2f", pvForecasts), String.format("%.2f", pvTerminal),
                String.format("%.2f", equityValue));

        return ValuationResult.builder()
                .method(METHOD)
                .value(equityValue)
                .details(details)
                .assumptions(used)
                .build();
    }

    /**
     * Re-runs the kernel with exactly one input replaced.
     */
    public ValuationResult dcfSensitivityAnalysis(Company company,
                                                  SensitivityParameter parameter,
                                                  double value,
                                                  DcfAssumptions assumptions) {
        return dcfValuation(company, DcfOverrides.NONE.with(parameter, value), assumptions);
    }

    public ValuationResult dcfSensitivityAnalysis(Company company, SensitivityParameter parameter, double value) {
        return dcfSensitivityAnalysis(company, parameter, value, defaultAssumptions);
    }

    /** Current value of a sweepable parameter, WACC included. */
    public double baseParameterValue(Company company, SensitivityParameter parameter) {
        return switch (parameter) {
            case GROWTH_RATE -> company.getGrowthRate();
            case OPERATING_MARGIN -> company.resolvedOperatingMargin();
            case WACC -> calculateWacc(company);
            case TERMINAL_GROWTH_RATE -> company.getTerminalGrowthRate();
            case TAX_RATE -> company.getTaxRate();
            case REVENUE -> company.getRevenue();
        };
    }

    private static void requireSpread(double wacc, double terminalGrowth, double minSpread) {
        if (wacc - terminalGrowth <= minSpread) {
            throw new DegenerateModelException("wacc", String.format(
                    "wacc (%.4f) must exceed terminal growth (%.4f) by more than %.4f",
                    wacc, terminalGrowth, minSpread));
        }
    }

    /** Forecast years carried in a DCF result; empty for results of other methods. */
    public static List<ForecastYear> forecasts(ValuationResult result) {
        if (!(result.getDetails().get(DETAIL_FORECASTS) instanceof List<?> raw)) {
            return List.of();
        }
        List<ForecastYear> forecasts = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (item instanceof ForecastYear forecast) {
                forecasts.add(forecast);
            }
        }
        return List.copyOf(forecasts);
    }

}
