package com.valuation.riskengine.domain.service;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.CompanyStage;
import com.valuation.riskengine.domain.model.ComparableCompany;
import com.valuation.riskengine.domain.model.ComprehensiveSensitivity;
import com.valuation.riskengine.domain.model.Recommendation;
import com.valuation.riskengine.domain.model.Recommendation.Confidence;
import com.valuation.riskengine.domain.model.RelativeMethod;
import com.valuation.riskengine.domain.model.ScenarioComparison;
import com.valuation.riskengine.domain.model.StressReport;
import com.valuation.riskengine.domain.model.ValuationReport;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.alternative.AlternativeValuationService;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.relative.RelativeValuationOptions;
import com.valuation.riskengine.domain.service.relative.RelativeValuationService;
import com.valuation.riskengine.domain.service.scenario.ScenarioAnalysisService;
import com.valuation.riskengine.domain.service.sensitivity.SensitivityAnalysisService;
import com.valuation.riskengine.domain.service.stress.StressTestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs every analysis for one company and cross-checks the method values.
 * Only invalid input fails the call; a sub-analysis that cannot produce a
 * result is recorded in the report's warnings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationEngine {

    static final double RANGE_LOW_FACTOR = 0.9;
    static final double RANGE_HIGH_FACTOR = 1.1;

    private final RelativeValuationService relativeValuationService;
    private final DcfValuationService dcfValuationService;
    private final ScenarioAnalysisService scenarioAnalysisService;
    private final StressTestService stressTestService;
    private final SensitivityAnalysisService sensitivityAnalysisService;
    private final AlternativeValuationService alternativeValuationService;

    public ValuationReport fullValuation(Company company, List<ComparableCompany> comparables, boolean riskAnalysis) {
        return fullValuation(company, comparables, null, riskAnalysis, null);
    }

    public ValuationReport fullValuation(Company company,
                                         List<ComparableCompany> comparables,
                                         RelativeValuationOptions options,
                                         boolean riskAnalysis,
                                         Long seed) {
        CompanyValidator.validate(company);
        long startNano = System.nanoTime();
        List<String> warnings = new ArrayList<>();

        Map<RelativeMethod, ValuationResult> relative = new EnumMap<>(RelativeMethod.class);
        ValuationResult composite = null;
        if (comparables != null && !comparables.isEmpty()) {
            relative = options != null
                    ? relativeValuationService.autoComparableAnalysis(company, comparables, options)
                    : relativeValuationService.autoComparableAnalysis(company, comparables);
            if (relative.isEmpty()) {
                warnings.add("relative valuation unavailable: no method had usable comparables");
            }
            composite = relativeValuationService.weightedComposite(relative).orElse(null);
        } else {
            warnings.add("relative valuation skipped: no comparables supplied");
        }

        ValuationResult dcf = attempt("dcf", warnings, () -> dcfValuationService.dcfValuation(company));

        ScenarioComparison scenario = null;
        StressReport stress = null;
        ComprehensiveSensitivity sensitivity = null;
        if (riskAnalysis) {
            scenario = attempt("scenario", warnings, () -> scenarioAnalysisService.compareScenarios(company));
            stress = attempt("stress", warnings, () -> stressTestService.generateStressReport(company, seed));
            sensitivity = attempt("sensitivity", warnings,
                    () -> sensitivityAnalysisService.comprehensiveSensitivity(company));
        }

        Map<String, Double> methodValues = new LinkedHashMap<>();
        for (Map.Entry<RelativeMethod, ValuationResult> entry : relative.entrySet()) {
            methodValues.put(entry.getKey().name(), entry.getValue().getValue());
        }
        if (dcf != null) {
            methodValues.put(DcfValuationService.METHOD, dcf.getValue());
        }
        Recommendation recommendation = recommend(methodValues).orElse(null);
        if (recommendation == null) {
            warnings.add("no recommendation: no method produced a positive value");
        }

        long elapsedMs = (System.nanoTime() - startNano) / 1_000_000;
        log.info("[Engine] full valuation done: company={}, relativeMethods={}, dcf={}, risk={}, warnings={}, elapsed={}ms",
                company.displayName(), relative.size(), dcf != null, riskAnalysis, warnings.size(), elapsedMs);

        return ValuationReport.builder()
                .companyName(company.displayName())
                .industry(company.getIndustry())
                .stage(company.getStage())
                .timestamp(System.currentTimeMillis())
                .relative(relative)
                .relativeComposite(composite)
                .dcf(dcf)
                .scenario(scenario)
                .stress(stress)
                .sensitivity(sensitivity)
                .recommendation(recommendation)
                .warnings(List.copyOf(warnings))
                .build();
    }

    /**
     * Values the company with the method its stage favours: price/sales for
     * loss-making early and growth companies, the projected venture capital
     * method for other early companies, price/earnings for profitable mature
     * and listed ones, DCF otherwise. A method that cannot run on the given
     * inputs falls back to DCF.
     */
    public ValuationResult quickValuation(Company company, List<ComparableCompany> comparables) {
        CompanyValidator.validate(company);
        Optional<RelativeMethod> preferred = preferredRelativeMethod(company);
        if (preferred.isPresent()) {
            if (comparables == null || comparables.isEmpty()) {
                log.info("[Engine] quick valuation falls back to DCF, no comparables: company={}, preferred={}",
                        company.displayName(), preferred.get());
            } else {
                try {
                    return relativeValuationService.valuate(company, comparables, preferred.get(),
                            RelativeValuationOptions.NONE);
                } catch (DegenerateModelException e) {
                    log.info("[Engine] quick valuation falls back to DCF: company={}, preferred={}, reason={}",
                            company.displayName(), preferred.get(), e.getMessage());
                }
            }
        } else if (company.getStage() == CompanyStage.EARLY) {
            try {
                return alternativeValuationService.vcWithProjection(company);
            } catch (DegenerateModelException e) {
                log.info("[Engine] quick valuation falls back to DCF: company={}, preferred=VC, reason={}",
                        company.displayName(), e.getMessage());
            }
        }
        return dcfValuationService.dcfValuation(company);
    }

    static Optional<RelativeMethod> preferredRelativeMethod(Company company) {
        boolean profitable = company.getNetIncome() > 0;
        return switch (company.getStage()) {
            case EARLY -> company.getRevenue() > 0 && !profitable
                    ? Optional.of(RelativeMethod.PS) : Optional.empty();
            case GROWTH -> profitable ? Optional.empty() : Optional.of(RelativeMethod.PS);
            case MATURE, LISTED -> profitable ? Optional.of(RelativeMethod.PE) : Optional.empty();
        };
    }

    /**
     * Median of the positive method values, widened to
     * [min * 0.9, max * 1.1]. Confidence follows the population coefficient
     * of variation.
     */
    static Optional<Recommendation> recommend(Map<String, Double> methodValues) {
        Map<String, Double> positive = new LinkedHashMap<>();
        methodValues.forEach((method, value) -> {
            if (value != null && value > 0) {
                positive.put(method, value);
            }
        });
        if (positive.isEmpty()) {
            return Optional.empty();
        }
        double[] sorted = DescriptiveStatistics.sortedCopy(positive.values());
        double mean = DescriptiveStatistics.mean(sorted);
        double cv = DescriptiveStatistics.populationStd(sorted, mean) / mean;

        return Optional.of(Recommendation.builder()
                .finalValue(DescriptiveStatistics.median(sorted))
                .valueLow(sorted[0] * RANGE_LOW_FACTOR)
                .valueHigh(sorted[sorted.length - 1] * RANGE_HIGH_FACTOR)
                .confidence(Confidence.fromCoefficientOfVariation(cv))
                .methodsUsed(sorted.length)
                .methodValues(positive)
                .build());
    }

    private <T> T attempt(String analysis, List<String> warnings, Supplier<T> body) {
        try {
            return body.get();
        } catch (ValuationException e) {
            log.warn("[Engine] {} analysis failed: field={}, reason={}", analysis, e.getField(), e.getMessage());
            warnings.add(analysis + " unavailable: " + e.getMessage());
            return null;
        }
    }
}
