package com.valuation.riskengine.domain.service.alternative;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.RelativeMethod;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.DegenerateModelException;
import com.valuation.riskengine.domain.service.DescriptiveStatistics;
import com.valuation.riskengine.domain.service.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Valuation methods for companies that neither multiples nor a DCF capture
 * well: venture capital back-solving, asset-based methods, precedent
 * transactions, the First Chicago method and sum of the parts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlternativeValuationService {

    public static final String METHOD_VC = "VC";
    public static final String METHOD_VC_PROJECTION = "VC_PROJECTION";
    public static final String METHOD_COST = "COST";
    public static final String METHOD_ADJUSTED_NET_ASSET = "ADJUSTED_NET_ASSET";
    public static final String METHOD_TRANSACTION = "TRANSACTION_COMPARABLE";
    public static final String METHOD_FIRST_CHICAGO = "FIRST_CHICAGO";
    public static final String METHOD_SUM_OF_PARTS = "SUM_OF_PARTS";

    private final AlternativeValuationProperties properties;

    /**
     * Back-solves today's value from an exit value and the investor's target
     * return multiple.
     */
    public ValuationResult vcMethod(Company company, VcExit exit) {
        CompanyValidator.validate(company);
        VcExit request = exit != null ? exit : new VcExit(null, null, null, null, null);
        double targetMultiple = request.targetReturnMultiple() != null
                ? request.targetReturnMultiple() : properties.getVcTargetReturnMultiple();
        int years = request.investmentYears() != null ? request.investmentYears() : properties.getVcInvestmentYears();
        RelativeMethod exitMethod = request.exitMethod() != null ? request.exitMethod() : RelativeMethod.PE;
        if (!(targetMultiple > 0) || !Double.isFinite(targetMultiple)) {
            throw new InvalidInputException("targetReturnMultiple",
                    "targetReturnMultiple must be > 0, got " + targetMultiple);
        }
        if (years < 1) {
            throw new InvalidInputException("investmentYears", "investmentYears must be >= 1, got " + years);
        }

        Double exitValuation = request.exitValuation();
        boolean projected = false;
        if (request.exitMultiple() != null) {
            if (!(request.exitMultiple() > 0)) {
                throw new InvalidInputException("exitMultiple", "exitMultiple must be > 0, got " + request.exitMultiple());
            }
            double growth = Math.pow(1 + company.getGrowthRate(), years);
            if (exitMethod == RelativeMethod.PE && company.getNetIncome() > 0) {
                exitValuation = company.getNetIncome() * growth * request.exitMultiple();
                projected = true;
            } else if (exitMethod == RelativeMethod.PS && company.getRevenue() > 0) {
                exitValuation = company.getRevenue() * growth * request.exitMultiple();
                projected = true;
            }
        }
        if (exitValuation == null || !Double.isFinite(exitValuation)) {
            throw new InvalidInputException("exitValuation",
                    "exitValuation is required unless an exitMultiple can be applied to a positive metric");
        }

        double value = exitValuation / targetMultiple;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exitValuation", exitValuation);
        details.put("exitProjected", projected);
        details.put("targetReturnMultiple", targetMultiple);
        details.put("investmentYears", years);
        details.put("exitMethod", exitMethod.name());
        details.put("exitMultiple", request.exitMultiple());
        details.put("impliedIrr", impliedIrr(targetMultiple, years));

        log.info("[Alternative] VC valuation done: company={}, exit={}, value={}",
                company.displayName(), exitValuation, value);
        return ValuationResult.builder()
                .method(METHOD_VC)
                .value(value)
                .details(details)
                .assumptions(Map.of("growthRate", company.getGrowthRate()))
                .build();
    }

    public ValuationResult vcWithProjection(Company company) {
        return vcWithProjection(company, properties.defaultProjection());
    }

    /**
     * Grows net income to the exit year, capitalises it at the target P/E
     * and divides by the target return multiple.
     *
     * @throws DegenerateModelException when net income is not positive, as a
     *         loss cannot be capitalised into an exit value
     */
    public ValuationResult vcWithProjection(Company company, VcProjection projection) {
        CompanyValidator.validate(company);
        if (projection == null) {
            throw new InvalidInputException("projection", "projection is required");
        }
        if (!(company.getNetIncome() > 0)) {
            throw new DegenerateModelException("netIncome",
                    "VC projection needs positive net income, got " + company.getNetIncome());
        }

        double futureNetIncome = company.getNetIncome();
        for (int year = 0; year < projection.projectionYears(); year++) {
            futureNetIncome *= (1 + company.getGrowthRate()) * (1 + projection.marginImprovement());
        }
        double exitValuation = futureNetIncome * projection.targetPe();
        double value = exitValuation / projection.targetReturnMultiple();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("futureNetIncome", futureNetIncome);
        details.put("targetPe", projection.targetPe());
        details.put("exitValuation", exitValuation);
        details.put("targetReturnMultiple", projection.targetReturnMultiple());
        details.put("projectionYears", projection.projectionYears());
        details.put("impliedIrr", impliedIrr(projection.targetReturnMultiple(), projection.projectionYears()));

        Map<String, Object> assumptions = new LinkedHashMap<>();
        assumptions.put("growthRate", company.getGrowthRate());
        assumptions.put("marginImprovement", projection.marginImprovement());

        log.info("[Alternative] VC projection done: company={}, futureNetIncome={}, value={}",
                company.displayName(), futureNetIncome, value);
        return ValuationResult.builder()
                .method(METHOD_VC_PROJECTION)
                .value(value)
                .details(details)
                .assumptions(assumptions)
                .build();
    }

    /** Book net assets plus appraised intangibles and goodwill, scaled by an adjustment factor. */
    public ValuationResult costMethod(Company company, double intangibleAssetValue, double goodwillValue,
                                      double adjustmentFactor) {
        CompanyValidator.validate(company);
        double netAssets = requireNetAssets(company);
        requireFinite("intangibleAssetValue", intangibleAssetValue);
        requireFinite("goodwillValue", goodwillValue);
        if (!(adjustmentFactor > 0) || !Double.isFinite(adjustmentFactor)) {
            throw new InvalidInputException("adjustmentFactor", "adjustmentFactor must be > 0, got " + adjustmentFactor);
        }

        double adjustedNetAssets = netAssets + intangibleAssetValue + goodwillValue;
        double value = adjustedNetAssets * adjustmentFactor;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("netAssets", netAssets);
        details.put("intangibleAssetValue", intangibleAssetValue);
        details.put("goodwillValue", goodwillValue);
        details.put("adjustedNetAssets", adjustedNetAssets);
        details.put("adjustmentFactor", adjustmentFactor);
        details.put("priceToBook", netAssets > 0 ? value / netAssets : null);

        log.debug("[Alternative] cost method: company={}, value={}", company.displayName(), value);
        return ValuationResult.builder().method(METHOD_COST).value(value).details(details).build();
    }

    /** Net assets restated at fair value: asset adjustments added, liability adjustments subtracted. */
    public ValuationResult adjustedNetAssetMethod(Company company,
                                                  Map<String, Double> assetAdjustments,
                                                  Map<String, Double> liabilityAdjustments) {
        CompanyValidator.validate(company);
        double netAssets = requireNetAssets(company);
        double assetTotal = sumAdjustments("assetAdjustments", assetAdjustments);
        double liabilityTotal = sumAdjustments("liabilityAdjustments", liabilityAdjustments);
        double value = netAssets + assetTotal - liabilityTotal;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("originalNetAssets", netAssets);
        details.put("assetAdjustments", assetAdjustments != null ? assetAdjustments : Map.of());
        details.put("liabilityAdjustments", liabilityAdjustments != null ? liabilityAdjustments : Map.of());
        details.put("totalAssetAdjustment", assetTotal);
        details.put("totalLiabilityAdjustment", liabilityTotal);
        details.put("adjustedNetAssets", value);

        log.debug("[Alternative] adjusted net assets: company={}, value={}", company.displayName(), value);
        return ValuationResult.builder().method(METHOD_ADJUSTED_NET_ASSET).value(value).details(details).build();
    }

    /**
     * Applies the median deal multiple to net income, or to revenue when the
     * company is loss-making. The range uses the lowest and highest deal
     * multiple.
     */
    public ValuationResult transactionComparable(Company company, List<PrecedentTransaction> transactions) {
        CompanyValidator.validate(company);
        if (transactions == null || transactions.isEmpty()) {
            throw new InvalidInputException("transactions", "at least one transaction is required");
        }
        List<Double> multiples = new ArrayList<>(transactions.size());
        for (PrecedentTransaction transaction : transactions) {
            if (transaction != null && transaction.multiple() != null
                    && transaction.multiple() > 0 && Double.isFinite(transaction.multiple())) {
                multiples.add(transaction.multiple());
            }
        }
        if (multiples.isEmpty()) {
            throw new InvalidInputException("transactions", "no transaction carries a positive multiple");
        }

        String metricName;
        double metric;
        if (company.getNetIncome() > 0) {
            metricName = "netIncome";
            metric = company.getNetIncome();
        } else if (company.getRevenue() > 0) {
            metricName = "revenue";
            metric = company.getRevenue();
        } else {
            throw new DegenerateModelException("metric", "neither net income nor revenue is positive");
        }

        double[] sorted = DescriptiveStatistics.sortedCopy(multiples);
        double median = DescriptiveStatistics.median(sorted);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transactionCount", transactions.size());
        details.put("usableMultiples", sorted.length);
        details.put("averageMultiple", DescriptiveStatistics.mean(sorted));
        details.put("medianMultiple", median);
        details.put("minMultiple", sorted[0]);
        details.put("maxMultiple", sorted[sorted.length - 1]);
        details.put("metricUsed", metricName);
        details.put("metricValue", metric);

        log.info("[Alternative] transaction comparables done: company={}, deals={}, median={}",
                company.displayName(), sorted.length, median);
        return ValuationResult.builder()
                .method(METHOD_TRANSACTION)
                .value(metric * median)
                .valueLow(metric * sorted[0])
                .valueHigh(metric * sorted[sorted.length - 1])
                .details(details)
                .build();
    }

    public ValuationResult firstChicago(double successValue, double failureValue) {
        return firstChicago(successValue, failureValue, properties.getFirstChicagoSuccessProbability());
    }

    /** Probability-weighted value of a success case and a failure case. */
    public ValuationResult firstChicago(double successValue, double failureValue, double probabilityOfSuccess) {
        requireFinite("successValue", successValue);
        requireFinite("failureValue", failureValue);
        if (!(probabilityOfSuccess >= 0 && probabilityOfSuccess <= 1)) {
            throw new InvalidInputException("probabilityOfSuccess",
                    "probabilityOfSuccess must be in [0, 1], got " + probabilityOfSuccess);
        }
        double value = successValue * probabilityOfSuccess + failureValue * (1 - probabilityOfSuccess);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("successValue", successValue);
        details.put("failureValue", failureValue);
        details.put("probabilityOfSuccess", probabilityOfSuccess);

        return ValuationResult.builder()
                .method(METHOD_FIRST_CHICAGO)
                .value(value)
                .valueLow(Math.min(successValue, failureValue))
                .valueHigh(Math.max(successValue, failureValue))
                .details(details)
                .build();
    }

    /**
     * Sums the business units and removes the corporate discount. A unit
     * with neither a direct value nor revenue and multiple is skipped.
     */
    public ValuationResult sumOfParts(List<BusinessUnit> units) {
        if (units == null || units.isEmpty()) {
            throw new InvalidInputException("businessUnits", "at least one business unit is required");
        }
        double partsValue = 0.0;
        List<Map<String, Object>> parts = new ArrayList<>(units.size());
        for (BusinessUnit unit : units) {
            Double unitValue = unitValue(unit);
            if (unitValue == null) {
                log.warn("[Alternative] business unit skipped, no value or revenue x multiple: unit={}",
                        unit != null ? unit.name() : null);
                continue;
            }
            partsValue += unitValue;

            Map<String, Object> part = new LinkedHashMap<>();
            part.put("name", unit.name());
            part.put("value", unitValue);
            part.put("revenue", unit.revenue());
            part.put("multiple", unit.multiple());
            parts.add(part);
        }
        if (parts.isEmpty()) {
            throw new InvalidInputException("businessUnits", "no business unit can be valued");
        }

        double corporateDiscount = partsValue * properties.getSumOfPartsCorporateDiscount();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("partsValue", partsValue);
        details.put("corporateDiscount", corporateDiscount);
        details.put("businessUnits", parts);

        return ValuationResult.builder()
                .method(METHOD_SUM_OF_PARTS)
                .value(partsValue - corporateDiscount)
                .details(details)
                .build();
    }

    private static Double unitValue(BusinessUnit unit) {
        if (unit == null) return null;
        if (unit.value() != null && unit.value() != 0.0 && Double.isFinite(unit.value())) {
            return unit.value();
        }
        if (unit.revenue() != null && unit.multiple() != null) {
            double value = unit.revenue() * unit.multiple();
            return Double.isFinite(value) && value != 0.0 ? value : null;
        }
        return null;
    }

    static double impliedIrr(double returnMultiple, int years) {
        return Math.pow(returnMultiple, 1.0 / years) - 1;
    }

    private static double requireNetAssets(Company company) {
        Double netAssets = company.getNetAssets();
        if (netAssets == null || netAssets == 0.0) {
            throw new InvalidInputException("netAssets", "net assets are required for asset-based methods");
        }
        return netAssets;
    }

    private static double sumAdjustments(String field, Map<String, Double> adjustments) {
        if (adjustments == null) return 0.0;
        double total = 0.0;
        for (Map.Entry<String, Double> entry : adjustments.entrySet()) {
            if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                throw new InvalidInputException(field, "adjustment '" + entry.getKey() + "' must be a finite number");
            }
            total += entry.getValue();
        }
        return total;
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(field, field + " must be a finite number");
        }
    }
}
