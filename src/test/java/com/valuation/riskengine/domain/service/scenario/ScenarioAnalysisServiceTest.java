package com.valuation.riskengine.domain.service.scenario;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuation.riskengine.TestFixtures;
import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ProbabilityWeightedValuation;
import com.valuation.riskengine.domain.model.ScenarioComparison;
import com.valuation.riskengine.domain.model.ScenarioConfig;
import com.valuation.riskengine.domain.service.DegenerateModelException;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfProperties;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioAnalysisServiceTest {

    private final DcfValuationService dcf = new DcfValuationService(new DcfProperties());
    private final ScenarioAnalysisService service = new ScenarioAnalysisService(dcf, new ScenarioProperties());

    @Test
    void compareScenarios_shouldRunBaseBullAndBearByDefault() {
        ScenarioComparison comparison = service.compareScenarios(TestFixtures.company());

        assertEquals(List.of("base", "bull", "bear"), List.copyOf(comparison.getScenarios().keySet()));
        double base = comparison.getScenarios().get("base").value();
        double bull = comparison.getScenarios().get("bull").value();
        double bear = comparison.getScenarios().get("bear").value();
        assertTrue(bull > base);
        assertTrue(base > bear);
        assertEquals(3, comparison.getStatistics().getCount());
        assertEquals(bull - bear, comparison.getStatistics().getRange(), 1e-6);
        assertEquals(base, comparison.getStatistics().getMedian(), 1e-6);
    }

    @Test
    void runScenario_shouldMatchBaseDcfForZeroDeltas() {
        Company company = TestFixtures.company();

        double scenario = service.runScenario(company, ScenarioConfig.base()).value();

        assertEquals(dcf.dcfValuation(company).getValue(), scenario, 1e-6);
    }

    @Test
    void runScenario_shouldAddWaccDeltaToDerivedRate() {
        Company company = TestFixtures.company();
        ScenarioConfig higherWacc = ScenarioConfig.builder().name("rates up").waccAdj(0.02).build();

        double scenario = service.runScenario(company, higherWacc).value();
        double expected = dcf.dcfValuation(company, DcfOverrides.builder().waccAdjustment(0.02).build()).getValue();

        assertEquals(expected, scenario, 1e-6);
    }

    @Test
    void compareScenarios_shouldSerialiseStatisticsNextToScenarioNames() {
        ScenarioComparison comparison = service.compareScenarios(TestFixtures.company());

        JsonNode json = new ObjectMapper().valueToTree(comparison);

        assertTrue(json.has("base"));
        assertTrue(json.has("bull"));
        assertTrue(json.has("bear"));
        assertTrue(json.has(ScenarioComparison.STATISTICS_KEY));
        assertFalse(json.has("scenarios"));
        assertEquals(4, json.size());
    }

    @Test
    void compareScenarios_shouldRejectReservedScenarioName() {
        List<ScenarioConfig> scenarios = List.of(ScenarioConfig.builder().name("statistics").build());

        assertThrows(InvalidInputException.class,
                () -> service.compareScenarios(TestFixtures.company(), scenarios, dcf.defaultAssumptions()));
    }

    @Test
    void compareScenarios_shouldRejectDuplicateNames() {
        List<ScenarioConfig> scenarios = List.of(ScenarioConfig.base(), ScenarioConfig.base());

        assertThrows(InvalidInputException.class,
                () -> service.compareScenarios(TestFixtures.company(), scenarios, dcf.defaultAssumptions()));
    }

    @Test
    void compareScenarios_shouldListDegenerateScenarioAsFailed() {
        List<ScenarioConfig> scenarios = List.of(
                ScenarioConfig.base(),
                ScenarioConfig.builder().name("collapse").waccAdj(-0.08).build());

        ScenarioComparison comparison =
                service.compareScenarios(TestFixtures.company(), scenarios, dcf.defaultAssumptions());

        assertEquals(List.of("collapse"), comparison.getFailedScenarios());
        assertEquals(1, comparison.getStatistics().getCount());
        assertFalse(comparison.getScenarios().containsKey("collapse"));
    }

    @Test
    void probabilityWeighted_shouldNormaliseProbabilities() {
        Company company = TestFixtures.company();
        List<ScenarioConfig> defaults = new ScenarioProperties().defaultScenarios();
        List<WeightedScenario> weighted = List.of(
                new WeightedScenario(defaults.get(0), 2.0),
                new WeightedScenario(defaults.get(1), 1.0),
                new WeightedScenario(defaults.get(2), 1.0));

        ProbabilityWeightedValuation result = service.probabilityWeighted(company, weighted, dcf.defaultAssumptions());

        ScenarioComparison comparison = service.compareScenarios(company);
        double expected = 0.5 * comparison.getScenarios().get("base").value()
                + 0.25 * comparison.getScenarios().get("bull").value()
                + 0.25 * comparison.getScenarios().get("bear").value();
        assertEquals(expected, result.getExpectedValue(), 1e-3);
        assertEquals(4.0, result.getTotalProbability(), 1e-12);
        assertEquals(0.5, result.getOutcomes().get(0).normalisedProbability(), 1e-12);
    }

    @Test
    void probabilityWeighted_shouldRejectNegativeProbability() {
        List<WeightedScenario> weighted = List.of(new WeightedScenario(ScenarioConfig.base(), -0.1));

        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.probabilityWeighted(TestFixtures.company(), weighted, dcf.defaultAssumptions()));
        assertEquals("probability", e.getField());
    }

    @Test
    void probabilityWeighted_shouldPropagateDegenerateScenario() {
        List<WeightedScenario> weighted = List.of(
                new WeightedScenario(ScenarioConfig.base(), 0.5),
                new WeightedScenario(ScenarioConfig.builder().name("collapse").waccAdj(-0.08).build(), 0.5));

        assertThrows(DegenerateModelException.class,
                () -> service.probabilityWeighted(TestFixtures.company(), weighted, dcf.defaultAssumptions()));
    }
}
