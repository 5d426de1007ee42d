package com.valuation.riskengine.domain.service.stress;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.MonteCarloResult;
import com.valuation.riskengine.domain.model.StressReport;
import com.valuation.riskengine.domain.model.StressTestResult;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloProperties;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloRequest;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloSimulationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Deterministic shocks against the DCF base case. Every test reports
 * {@code changePct = (stressed - base) / base}. A base that is not positive
 * (net debt above enterprise value) has no meaningful relative change and
 * reports 0.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StressTestService {

    public static final String REVENUE_SHOCK = "revenue_shock";
    public static final String MARGIN_COMPRESSION = "margin_compression";
    public static final String WACC_SHOCK = "wacc_shock";
    public static final String GROWTH_SLOWDOWN = "growth_slowdown";
    public static final String EXTREME_CRASH = "extreme_market_crash";

    private final DcfValuationService dcfValuationService;
    private final MonteCarloSimulationService monteCarloSimulationService;
    private final StressTestProperties properties;
    private final MonteCarloProperties monteCarloProperties;

    /** Scales base revenue by {@code 1 + shock} for every forecast year. */
    public List<StressTestResult> revenueShockTest(Company company, List<Double> shocks, DcfAssumptions assumptions) {
        StressShocks.requireLevels("shocks", shocks);
        double base = baseValue(company, assumptions);
        List<StressTestResult> results = new ArrayList<>(shocks.size());
        for (double shock : shocks) {
            StressShocks.requireRevenueShock(shock);
            double revenue = company.getRevenue() * (1 + shock);
            double stressed = value(company, DcfOverrides.builder().revenue(revenue).build(), assumptions);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("shock", shock);
            details.put("baseRevenue", company.getRevenue());
            details.put("stressedRevenue", revenue);
            results.add(result(REVENUE_SHOCK,
                    String.format("Revenue %s %.0f%%", shock < 0 ? "down" : "up", Math.abs(shock) * 100),
                    base, stressed, details));
        }
        return results;
    }

    /** Subtracts each compression from the operating margin, floored at zero. */
    public List<StressTestResult> marginCompressionTest(Company company,
                                                        List<Double> compressions,
                                                        DcfAssumptions assumptions) {
        StressShocks.requireLevels("compressions", compressions);
        double base = baseValue(company, assumptions);
        double baseMargin = company.resolvedOperatingMargin();
        List<StressTestResult> results = new ArrayList<>(compressions.size());
        for (double compression : compressions) {
            double margin = Math.max(0.0, baseMargin - compression);
            double stressed = value(company, DcfOverrides.builder().operatingMargin(margin).build(), assumptions);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("compression", compression);
            details.put("baseMargin", baseMargin);
            details.put("stressedMargin", margin);
            results.add(result(MARGIN_COMPRESSION,
                    String.format("Operating margin down %.0f pts (%.1f%% -> %.1f%%)",
                            compression * 100, baseMargin * 100, margin * 100),
                    base, stressed, details));
        }
        return results;
    }

    public List<StressTestResult> waccShockTest(Company company, List<Double> increases, DcfAssumptions assumptions) {
        StressShocks.requireLevels("increases", increases);
        double base = baseValue(company, assumptions);
        double baseWacc = dcfValuationService.calculateWacc(company);
        List<StressTestResult> results = new ArrayList<>(increases.size());
        for (double increase : increases) {
            double stressed = value(company, DcfOverrides.builder().waccAdjustment(increase).build(), assumptions);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("waccIncrease", increase);
            details.put("baseWacc", baseWacc);
            details.put("stressedWacc", baseWacc + increase);
            results.add(result(WACC_SHOCK,
                    String.format("WACC up %.1f pts (%.2f%% -> %.2f%%)",
                            increase * 100, baseWacc * 100, (baseWacc + increase) * 100),
                    base, stressed, details));
        }
        return results;
    }

    /** Multiplies the growth rate by each factor (0.5 halves growth). */
    public List<StressTestResult> growthSlowdownTest(Company company,
                                                     List<Double> factors,
                                                     DcfAssumptions assumptions) {
        StressShocks.requireLevels("factors", factors);
        double base = baseValue(company, assumptions);
        double baseGrowth = company.getGrowthRate();
        List<StressTestResult> results = new ArrayList<>(factors.size());
        for (double factor : factors) {
            double growth = baseGrowth * factor;
            double stressed = value(company, DcfOverrides.builder().growthRate(growth).build(), assumptions);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("slowdownFactor", factor);
            details.put("baseGrowth", baseGrowth);
            details.put("stressedGrowth", growth);
            results.add(result(GROWTH_SLOWDOWN,
                    String.format("Growth cut to %.0f%% of base (%.1f%% -> %.1f%%)",
                            factor * 100, baseGrowth * 100, growth * 100),
                    base, stressed, details));
        }
        return results;
    }

    /** Revenue, margin and WACC shocks applied together in one evaluation. */
    public StressTestResult extremeMarketCrash(Company company, StressShocks shocks, DcfAssumptions assumptions) {
        double base = baseValue(company, assumptions);
        double revenue = company.getRevenue() * (1 + shocks.crashRevenueShock());
        double margin = Math.max(0.0, company.resolvedOperatingMargin() - shocks.crashMarginCompression());
        double baseWacc = dcfValuationService.calculateWacc(company);

        DcfOverrides overrides = DcfOverrides.builder()
                .revenue(revenue)
                .operatingMargin(margin)
                .waccAdjustment(shocks.crashWaccShock())
                .build();
        double stressed = value(company, overrides, assumptions);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("revenueShock", shocks.crashRevenueShock());
        details.put("marginCompression", shocks.crashMarginCompression());
        details.put("waccIncrease", shocks.crashWaccShock());
        details.put("stressedRevenue", revenue);
        details.put("stressedMargin", margin);
        details.put("stressedWacc", baseWacc + shocks.crashWaccShock());

        return result(EXTREME_CRASH,
                String.format("Revenue %.0f%%, margin -%.0f pts, WACC +%.0f pts",
                        shocks.crashRevenueShock() * 100, shocks.crashMarginCompression() * 100,
                        shocks.crashWaccShock() * 100),
                base, stressed, details);
    }

    public StressReport generateStressReport(Company company, Long seed) {
        return generateStressReport(company, properties.toShocks(), monteCarloProperties.defaultRequest(seed),
                dcfValuationService.defaultAssumptions());
    }

    public StressReport generateStressReport(Company company,
                                             StressShocks shocks,
                                             MonteCarloRequest monteCarloRequest,
                                             DcfAssumptions assumptions) {
        double base = baseValue(company, assumptions);

        List<StressTestResult> revenue = revenueShockTest(company, shocks.revenueShocks(), assumptions);
        List<StressTestResult> margin = marginCompressionTest(company, shocks.marginCompressions(), assumptions);
        List<StressTestResult> wacc = waccShockTest(company, shocks.waccShocks(), assumptions);
        List<StressTestResult> growth = growthSlowdownTest(company, shocks.growthSlowdownFactors(), assumptions);
        StressTestResult crash = extremeMarketCrash(company, shocks, assumptions);
        MonteCarloResult monteCarlo = monteCarloSimulationService.simulate(company, monteCarloRequest, assumptions);

        double maxDownside = Stream.of(revenue, margin, wacc, growth, List.of(crash))
                .flatMap(List::stream)
                .mapToDouble(StressTestResult::getChangePct)
                .filter(change -> change < 0)
                .min()
                .orElse(0.0);

        log.info("[Stress] report done: company={}, base={}, maxDownside={}, mcValid={}",
                company.displayName(), base, maxDownside, monteCarlo.getValidIterations());

        return StressReport.builder()
                .companyName(company.displayName())
                .baseValue(base)
                .revenueShock(revenue)
                .marginCompression(margin)
                .waccShock(wacc)
                .growthSlowdown(growth)
                .extremeCrash(crash)
                .monteCarlo(monteCarlo)
                .maxDownside(maxDownside)
                .build();
    }

    public double baseValue(Company company, DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        return value(company, DcfOverrides.NONE, assumptions);
    }

    private double value(Company company, DcfOverrides overrides, DcfAssumptions assumptions) {
        return dcfValuationService.dcfValuation(company, overrides, assumptions).getValue();
    }

    private StressTestResult result(String testName, String description,
                                    double base, double stressed, Map<String, Object> details) {
        double changePct;
        if (!(base > 0.0)) {
            log.warn("[Stress] base value not positive, change reported as 0: test={}, base={}", testName, base);
            changePct = 0.0;
        } else {
            changePct = (stressed - base) / base;
        }
        log.debug("[Stress] {}: {} base={}, stressed={}, change={}",
                testName, description, base, stressed, changePct);
        return StressTestResult.builder()
                .testName(testName)
                .scenarioDescription(description)
                .baseValue(base)
                .stressedValue(stressed)
                .changePct(changePct)
                .details(details)
                .build();
    }
}
