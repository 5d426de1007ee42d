package com.valuation.riskengine.domain.service.scenario;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ProbabilityWeightedValuation;
import com.valuation.riskengine.domain.model.ProbabilityWeightedValuation.WeightedOutcome;
import com.valuation.riskengine.domain.model.ScenarioComparison;
import com.valuation.riskengine.domain.model.ScenarioConfig;
import com.valuation.riskengine.domain.model.ScenarioOutcome;
import com.valuation.riskengine.domain.model.ScenarioStatistics;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.DescriptiveStatistics;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.ValuationException;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioAnalysisService {

    private final DcfValuationService dcfValuationService;
    private final ScenarioProperties properties;

    public ScenarioOutcome runScenario(Company company, ScenarioConfig scenario) {
        return runScenario(company, scenario, dcfValuationService.defaultAssumptions());
    }

    /**
     * Applies the scenario's deltas to the company's growth, margin and
     * terminal growth, adds the WACC delta to the derived rate and runs DCF.
     */
    public ScenarioOutcome runScenario(Company company, ScenarioConfig scenario, DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        DcfOverrides overrides = DcfOverrides.builder()
                .growthRate(company.getGrowthRate() + scenario.getRevenueGrowthAdj())
                .operatingMargin(company.resolvedOperatingMargin() + scenario.getMarginAdj())
                .terminalGrowthRate(company.getTerminalGrowthRate() + scenario.getTerminalGrowthAdj())
                .waccAdjustment(scenario.getWaccAdj())
                .build();
        ValuationResult result = dcfValuationService.dcfValuation(company, overrides, assumptions);
        return new ScenarioOutcome(scenario, result);
    }

    public ScenarioComparison compareScenarios(Company company) {
        return compareScenarios(company, properties.defaultScenarios(), dcfValuationService.defaultAssumptions());
    }

    /**
     * Runs each scenario independently. A scenario whose DCF has no valid
     * answer is left out and listed in {@code failedScenarios}; statistics
     * cover the remaining ones.
     */
    public ScenarioComparison compareScenarios(Company company,
                                               List<ScenarioConfig> scenarios,
                                               DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        List<ScenarioConfig> effective = scenarios == null || scenarios.isEmpty()
                ? properties.defaultScenarios()
                : scenarios;
        validateNames(effective);

        Map<String, ScenarioOutcome> outcomes = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        for (ScenarioConfig scenario : effective) {
            try {
                outcomes.put(scenario.getName(), runScenario(company, scenario, assumptions));
            } catch (ValuationException e) {
                log.warn("[Scenario] scenario failed: company={}, scenario={}, field={}, reason={}",
                        company.displayName(), scenario.getName(), e.getField(), e.getMessage());
                failed.add(scenario.getName());
            }
        }

        List<Double> values = new ArrayList<>(outcomes.size());
        for (ScenarioOutcome outcome : outcomes.values()) {
            values.add(outcome.value());
        }
        ScenarioStatistics statistics = statistics(values);

        log.info("[Scenario] comparison done: company={}, scenarios={}, failed={}, min={}, max={}",
                company.displayName(), outcomes.size(), failed.size(),
                statistics.getMin(), statistics.getMax());
        return new ScenarioComparison(outcomes, statistics, failed);
    }

    /**
     * Expected value over the given scenarios. Unlike the comparison, a
     * failing scenario fails the whole call since dropping it would bias the
     * expectation.
     */
    public ProbabilityWeightedValuation probabilityWeighted(Company company,
                                                            List<WeightedScenario> weighted,
                                                            DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        if (weighted == null || weighted.isEmpty()) {
            throw new InvalidInputException("scenarios", "at least one weighted scenario is required");
        }
        List<ScenarioConfig> configs = new ArrayList<>(weighted.size());
        double total = 0.0;
        for (WeightedScenario ws : weighted) {
            if (ws.scenario() == null) {
                throw new InvalidInputException("scenarios", "weighted scenario without configuration");
            }
            if (!(ws.probability() >= 0) || !Double.isFinite(ws.probability())) {
                throw new InvalidInputException("probability",
                        "probability must be a finite value >= 0, got " + ws.probability());
            }
            configs.add(ws.scenario());
            total += ws.probability();
        }
        validateNames(configs);
        if (total <= 0) {
            throw new InvalidInputException("probability", "probabilities must not all be zero");
        }

        List<WeightedOutcome> outcomes = new ArrayList<>(weighted.size());
        double expected = 0.0;
        for (WeightedScenario ws : weighted) {
            double value = runScenario(company, ws.scenario(), assumptions).value();
            double normalised = ws.probability() / total;
            expected += normalised * value;
            outcomes.add(new WeightedOutcome(ws.scenario().getName(), ws.probability(), normalised, value));
        }

        log.info("[Scenario] probability-weighted done: company={}, scenarios={}, expected={}",
                company.displayName(), outcomes.size(), expected);
        return ProbabilityWeightedValuation.builder()
                .expectedValue(expected)
                .totalProbability(total)
                .outcomes(outcomes)
                .build();
    }

    private static void validateNames(List<ScenarioConfig> scenarios) {
        List<String> seen = new ArrayList<>(scenarios.size());
        for (ScenarioConfig scenario : scenarios) {
            if (scenario == null || scenario.getName() == null || scenario.getName().isBlank()) {
                throw new InvalidInputException("scenarios", "every scenario needs a name");
            }
            if (ScenarioComparison.STATISTICS_KEY.equals(scenario.getName())) {
                throw new InvalidInputException("scenarios",
                        "'" + ScenarioComparison.STATISTICS_KEY + "' is reserved and cannot name a scenario");
            }
            if (seen.contains(scenario.getName())) {
                throw new InvalidInputException("scenarios", "duplicate scenario name: " + scenario.getName());
            }
            seen.add(scenario.getName());
        }
    }

    private static ScenarioStatistics statistics(List<Double> values) {
        double[] sorted = DescriptiveStatistics.sortedCopy(values);
        double mean = DescriptiveStatistics.mean(sorted);
        double min = sorted.length > 0 ? sorted[0] : Double.NaN;
        double max = sorted.length > 0 ? sorted[sorted.length - 1] : Double.NaN;
        return ScenarioStatistics.builder()
                .count(sorted.length)
                .mean(mean)
                .median(DescriptiveStatistics.median(sorted))
                .std(DescriptiveStatistics.populationStd(sorted, mean))
                .min(min)
                .max(max)
                .range(max - min)
                .build();
    }
}
