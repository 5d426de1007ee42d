package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ComparableCompany;
import com.valuation.riskengine.domain.model.RelativeMethod;
import com.valuation.riskengine.domain.model.ValuationReport;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.MarketDataSource;
import com.valuation.riskengine.domain.service.ValuationEngine;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.history.ValuationHistoryService;
import com.valuation.riskengine.domain.service.relative.RelativeValuationOptions;
import com.valuation.riskengine.domain.service.relative.RelativeValuationProperties;
import com.valuation.riskengine.domain.service.relative.RelativeValuationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/valuation")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ValuationController {

    private final RelativeValuationService relativeValuationService;
    private final RelativeValuationProperties relativeProperties;
    private final DcfValuationService dcfValuationService;
    private final ValuationEngine valuationEngine;
    private final MarketDataSource marketDataSource;
    private final ValuationHistoryService historyService;

    public record RelativeRequest(Company company,
                                  List<ComparableCompany> comparables,
                                  RelativeValuationOptions options,
                                  Integer comparableLimit) {
    }

    public record AbsoluteRequest(Company company, DcfOverrides overrides, AssumptionsRequest assumptions) {
    }

    public record FullRequest(Company company,
                              List<ComparableCompany> comparables,
                              RelativeValuationOptions options,
                              Boolean riskAnalysis,
                              Long seed) {
    }

    @PostMapping("/relative")
    public ResponseEntity<Map<String, Object>> relative(@RequestBody RelativeRequest request) {
        Company company = CompanyValidator.validate(request.company());
        List<ComparableCompany> comparables = comparablesFor(company, request.comparables(), request.comparableLimit());
        RelativeValuationOptions options = request.options() != null
                ? request.options()
                : relativeProperties.defaultOptions();

        Map<RelativeMethod, ValuationResult> results =
                relativeValuationService.autoComparableAnalysis(company, comparables, options);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("company", company.displayName());
        body.put("comparableCount", comparables.size());
        body.put("results", results);
        body.put("composite", relativeValuationService.weightedComposite(results).orElse(null));
        body.put("statistics", relativeValuationService.comparableStatistics(comparables));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/absolute")
    public ResponseEntity<ValuationResult> absolute(@RequestBody AbsoluteRequest request) {
        DcfOverrides overrides = request.overrides() != null ? request.overrides() : DcfOverrides.NONE;
        return ResponseEntity.ok(dcfValuationService.dcfValuation(request.company(), overrides,
                AssumptionsRequest.resolve(request.assumptions(), dcfValuationService.defaultAssumptions())));
    }

    /** Relative methods and DCF side by side with the cross-checked recommendation, no risk analysis. */
    @PostMapping("/compare")
    public ResponseEntity<ValuationReport> compare(@RequestBody FullRequest request) {
        Company company = CompanyValidator.validate(request.company());
        return ResponseEntity.ok(valuationEngine.fullValuation(company,
                comparablesFor(company, request.comparables(), null), request.options(), false, request.seed()));
    }

    @PostMapping("/quick")
    public ResponseEntity<ValuationResult> quick(@RequestBody RelativeRequest request) {
        Company company = CompanyValidator.validate(request.company());
        return ResponseEntity.ok(valuationEngine.quickValuation(company,
                comparablesFor(company, request.comparables(), request.comparableLimit())));
    }

    @PostMapping("/full")
    public ResponseEntity<Map<String, Object>> full(@RequestBody FullRequest request) {
        Company company = CompanyValidator.validate(request.company());
        boolean riskAnalysis = request.riskAnalysis() == null || request.riskAnalysis();
        log.info("[Valuation API] full valuation requested: company={}, riskAnalysis={}",
                company.displayName(), riskAnalysis);

        ValuationReport report = valuationEngine.fullValuation(company,
                comparablesFor(company, request.comparables(), null), request.options(), riskAnalysis, request.seed());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("historyId", historyService.record(report).orElse(null));
        body.put("report", report);
        return ResponseEntity.ok(body);
    }

    /** Supplied peers win; otherwise peers of the company's industry are fetched from market data. */
    private List<ComparableCompany> comparablesFor(Company company, List<ComparableCompany> supplied, Integer limit) {
        if (supplied != null && !supplied.isEmpty()) {
            CompanyValidator.validateComparables(supplied);
            return supplied;
        }
        List<ComparableCompany> fetched =
                marketDataSource.findComparables(company.getIndustry(), limit != null ? limit : 0);
        log.info("[Valuation API] comparables fetched: industry={}, count={}", company.getIndustry(), fetched.size());
        return fetched;
    }
}
