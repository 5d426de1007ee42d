package com.valuation.riskengine.domain.service.relative;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ComparableCompany;
import com.valuation.riskengine.domain.model.MultipleStatistics;
import com.valuation.riskengine.domain.model.RelativeMethod;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.DegenerateModelException;
import com.valuation.riskengine.domain.service.DescriptiveStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Multiple-based valuation against comparable companies. The aggregate
 * multiple is the median of the usable peer multiples; the reported range
 * applies the lowest and highest peer multiple instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelativeValuationService {

    public static final String COMPOSITE_METHOD = "RELATIVE_COMPOSITE";

    private final RelativeValuationProperties properties;

    /**
     * Runs every method the inputs support. Unsupported methods are left out
     * of the result; an empty map means relative valuation is unavailable.
     */
    public Map<RelativeMethod, ValuationResult> autoComparableAnalysis(Company company,
                                                                       List<ComparableCompany> comparables) {
        return autoComparableAnalysis(company, comparables, properties.defaultOptions());
    }

    public Map<RelativeMethod, ValuationResult> autoComparableAnalysis(Company company,
                                                                       List<ComparableCompany> comparables,
                                                                       RelativeValuationOptions options) {
        CompanyValidator.validate(company);
        RelativeValuationOptions effective = options != null ? options.validate() : RelativeValuationOptions.NONE;

        Map<RelativeMethod, ValuationResult> results = new EnumMap<>(RelativeMethod.class);
        if (comparables == null || comparables.isEmpty()) {
            log.warn("[Relative] no comparables supplied, relative valuation unavailable: company={}",
                    company.displayName());
            return results;
        }
        CompanyValidator.validateComparables(comparables);

        for (RelativeMethod method : RelativeMethod.values()) {
            String skipReason = skipReason(company, comparables, method);
            if (skipReason != null) {
                log.warn("[Relative] method skipped: company={}, method={}, reason={}",
                        company.displayName(), method.label(), skipReason);
                continue;
            }
            results.put(method, compute(company, comparables, method, effective));
        }

        log.info("[Relative] auto analysis done: company={}, comparables={}, methods={}",
                company.displayName(), comparables.size(), results.keySet());
        return results;
    }

    /**
     * Values the company with one explicitly requested method.
     *
     * @throws DegenerateModelException when the company metric is not
     *         positive or no comparable supplies the multiple
     */
    public ValuationResult valuate(Company company,
                                   List<ComparableCompany> comparables,
                                   RelativeMethod method,
                                   RelativeValuationOptions options) {
        CompanyValidator.validate(company);
        RelativeValuationOptions effective = options != null ? options.validate() : RelativeValuationOptions.NONE;
        List<ComparableCompany> peers = comparables != null ? comparables : List.of();
        CompanyValidator.validateComparables(peers);

        String skipReason = skipReason(company, peers, method);
        if (skipReason != null) {
            throw new DegenerateModelException(metricField(method),
                    method.label() + " valuation not possible: " + skipReason);
        }
        return compute(company, peers, method, effective);
    }

    /**
     * Weighted average of the available method values. Weights of absent
     * methods are redistributed proportionally.
     */
    public Optional<ValuationResult> weightedComposite(Map<RelativeMethod, ValuationResult> results) {
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }
        Map<RelativeMethod, Double> weights = properties.getWeights();

        double totalWeight = 0.0;
        for (RelativeMethod method : results.keySet()) {
            totalWeight += weights.getOrDefault(method, 0.0);
        }
        if (totalWeight <= 0) {
            log.warn("[Relative] composite skipped, no positive weight: methods={}", results.keySet());
            return Optional.empty();
        }

        double weighted = 0.0;
        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        Map<String, Object> normalised = new LinkedHashMap<>();
        for (Map.Entry<RelativeMethod, ValuationResult> entry : results.entrySet()) {
            double weight = weights.getOrDefault(entry.getKey(), 0.0) / totalWeight;
            ValuationResult result = entry.getValue();
            weighted += weight * result.getValue();
            low = Math.min(low, result.getValueLow() != null ? result.getValueLow() : result.getValue());
            high = Math.max(high, result.getValueHigh() != null ? result.getValueHigh() : result.getValue());
            normalised.put(entry.getKey().name(), weight);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("weights", normalised);
        details.put("methodCount", results.size());

        return Optional.of(ValuationResult.builder()
                .method(COMPOSITE_METHOD)
                .value(weighted)
                .valueLow(low)
                .valueHigh(high)
                .details(details)
                .build());
    }

    public Map<RelativeMethod, MultipleStatistics> comparableStatistics(List<ComparableCompany> comparables) {
        List<ComparableCompany> peers = comparables != null ? comparables : List.of();
        CompanyValidator.validateComparables(peers);

        Map<RelativeMethod, MultipleStatistics> stats = new EnumMap<>(RelativeMethod.class);
        for (RelativeMethod method : RelativeMethod.values()) {
            double[] sorted = DescriptiveStatistics.sortedCopy(usableMultiples(peers, method));
            double mean = DescriptiveStatistics.mean(sorted);
            stats.put(method, new MultipleStatistics(
                    method,
                    sorted.length,
                    mean,
                    DescriptiveStatistics.median(sorted),
                    DescriptiveStatistics.populationStd(sorted, mean),
                    sorted.length > 0 ? sorted[0] : Double.NaN,
                    sorted.length > 0 ? sorted[sorted.length - 1] : Double.NaN));
        }
        return stats;
    }

    private ValuationResult compute(Company company,
                                    List<ComparableCompany> comparables,
                                    RelativeMethod method,
                                    RelativeValuationOptions options) {
        double[] sorted = DescriptiveStatistics.sortedCopy(usableMultiples(comparables, method));
        double medianMultiple = DescriptiveStatistics.median(sorted);
        double minMultiple = sorted[0];
        double maxMultiple = sorted[sorted.length - 1];

        double metric = companyMetric(company, method);
        boolean forward = options.isUseForwardMetrics()
                && (method == RelativeMethod.PE || method == RelativeMethod.PS);
        if (forward) {
            metric = metric * (1 + company.getGrowthRate());
        }

        double factor = options.adjustmentFactor();
        double value = toEquity(company, method, metric * medianMultiple) * factor;
        double low = toEquity(company, method, metric * minMultiple) * factor;
        double high = toEquity(company, method, metric * maxMultiple) * factor;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("multiple", medianMultiple);
        details.put("multipleLow", minMultiple);
        details.put("multipleHigh", maxMultiple);
        details.put("comparablesUsed", sorted.length);
        details.put("companyMetric", metric);
        details.put("forwardMetric", forward);
        if (method == RelativeMethod.EV_EBITDA) {
            details.put("enterpriseValue", metric * medianMultiple);
            details.put("netDebt", company.getNetDebt());
        }

        Map<String, Object> assumptions = new LinkedHashMap<>();
        assumptions.put("illiquidityDiscount", options.getIlliquidityDiscount());
        assumptions.put("controlPremium", options.getControlPremium());
        assumptions.put("adjustmentFactor", factor);

        log.debug("[Relative] {} done: company={}, metric={}, multiple={}, value={}",
                method.label(), company.displayName(), metric, medianMultiple, value);

        return ValuationResult.builder()
                .method(method.name())
                .value(value)
                .valueLow(Math.min(low, high))
                .valueHigh(Math.max(low, high))
                .details(details)
                .assumptions(assumptions)
                .build();
    }

    private String skipReason(Company company, List<ComparableCompany> comparables, RelativeMethod method) {
        Double metric = companyMetricOrNull(company, method);
        if (metric == null) {
            return metricField(method) + " not provided";
        }
        if (metric <= 0) {
            return metricField(method) + " is not positive (" + metric + ")";
        }
        if (usableMultiples(comparables, method).isEmpty()) {
            return "no comparable supplies a usable " + method.label() + " multiple";
        }
        return null;
    }

    private static List<Double> usableMultiples(List<ComparableCompany> comparables, RelativeMethod method) {
        List<Double> multiples = new ArrayList<>(comparables.size());
        for (ComparableCompany comparable : comparables) {
            Double multiple = comparable.multipleFor(method);
            if (multiple != null) {
                multiples.add(multiple);
            }
        }
        return multiples;
    }

    private static double toEquity(Company company, RelativeMethod method, double implied) {
        return method == RelativeMethod.EV_EBITDA ? implied - company.getNetDebt() : implied;
    }

    private static double companyMetric(Company company, RelativeMethod method) {
        Double metric = companyMetricOrNull(company, method);
        return metric != null ? metric : Double.NaN;
    }

    private static Double companyMetricOrNull(Company company, RelativeMethod method) {
        return switch (method) {
            case PE -> company.getNetIncome();
            case PS -> company.getRevenue();
            case PB -> company.getNetAssets();
            case EV_EBITDA -> company.getEbitda();
        };
    }

    private static String metricField(RelativeMethod method) {
        return switch (method) {
            case PE -> "netIncome";
            case PS -> "revenue";
            case PB -> "netAssets";
            case EV_EBITDA -> "ebitda";
        };
    }
}
