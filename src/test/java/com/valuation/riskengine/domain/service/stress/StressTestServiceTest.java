package com.valuation.riskengine.domain.service.stress;

import com.valuation.riskengine.TestFixtures;
import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.StressReport;
import com.valuation.riskengine.domain.model.StressTestResult;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfProperties;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloProperties;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloSimulationService;
import com.valuation.riskengine.domain.service.stress.montecarlo.ValuationDistributionAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StressTestServiceTest {

    private final DcfValuationService dcf = new DcfValuationService(new DcfProperties());
    private final MonteCarloProperties monteCarloProperties = new MonteCarloProperties();
    private final StressTestService service = new StressTestService(
            dcf,
            new MonteCarloSimulationService(dcf, new ValuationDistributionAggregator(), monteCarloProperties,
                    new SimpleMeterRegistry()),
            new StressTestProperties(),
            monteCarloProperties);
    private final DcfAssumptions assumptions = dcf.defaultAssumptions();

    private static Company debtFree() {
        return TestFixtures.company().toBuilder().totalDebt(0.0).cashAndEquivalents(0.0).build();
    }

    @Test
    void revenueShockTest_shouldScaleValueWithRevenueWhenDebtFree() {
        Company company = debtFree();
        double base = dcf.dcfValuation(company).getValue();

        StressTestResult result = service.revenueShockTest(company, List.of(-0.3), assumptions).get(0);

        assertEquals(StressTestService.REVENUE_SHOCK, result.getTestName());
        assertEquals(base, result.getBaseValue(), 1e-6);
        assertEquals(base * 0.7, result.getStressedValue(), base * 1e-9);
        assertEquals(-0.3, result.getChangePct(), 1e-9);
        assertTrue(result.getChangePct() < 0);
    }

    @Test
    void revenueShockTest_shouldReportNoChangeWhenBaseValueIsNegative() {
        Company overLevered = TestFixtures.company().toBuilder().totalDebt(5_000_000_000.0).build();

        StressTestResult result = service.revenueShockTest(overLevered, List.of(-0.3), assumptions).get(0);

        assertTrue(result.getBaseValue() < 0);
        assertTrue(result.getStressedValue() < result.getBaseValue());
        assertEquals(0.0, result.getChangePct(), 0.0);
    }

    @Test
    void generateStressReport_shouldNotReportDownsideForNegativeBase() {
        Company overLevered = TestFixtures.company().toBuilder().totalDebt(5_000_000_000.0).build();

        StressReport report = service.generateStressReport(overLevered, 7L);

        assertTrue(report.getBaseValue() < 0);
        assertEquals(0.0, report.getMaxDownside(), 0.0);
        for (StressTestResult result : report.getRevenueShock()) {
            assertEquals(0.0, result.getChangePct(), 0.0);
        }
    }

    @Test
    void revenueShockTest_shouldRejectMissingShockEntry() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.revenueShockTest(TestFixtures.company(), Arrays.asList(-0.1, null), assumptions));

        assertEquals("shocks", e.getField());
    }

    @Test
    void waccShockTest_shouldRejectNonFiniteIncrease() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.waccShockTest(TestFixtures.company(), List.of(Double.NaN), assumptions));

        assertEquals("increases", e.getField());
    }

    @Test
    void stressShocks_shouldRejectMissingLevel() {
        assertThrows(InvalidInputException.class, () -> new StressShocks(List.of(-0.1), Arrays.asList(0.05, null),
                List.of(0.01), List.of(0.5), -0.4, 0.1, 0.03));
    }

    @Test
    void revenueShockTest_shouldRejectShockBelowMinusOneHundredPercent() {
        assertThrows(InvalidInputException.class,
                () -> service.revenueShockTest(TestFixtures.company(), List.of(-1.5), assumptions));
    }

    @Test
    void marginCompressionTest_shouldFloorMarginAtZero() {
        StressTestResult result = service.marginCompressionTest(TestFixtures.company(), List.of(0.5), assumptions).get(0);

        assertEquals(0.0, (Double) result.getDetails().get("stressedMargin"), 0.0);
        assertTrue(result.getStressedValue() < result.getBaseValue());
    }

    @Test
    void marginCompressionTest_shouldLoseMoreValueForDeeperCompression() {
        List<StressTestResult> results =
                service.marginCompressionTest(TestFixtures.company(), List.of(0.05, 0.10, 0.15), assumptions);

        assertTrue(results.get(0).getChangePct() > results.get(1).getChangePct());
        assertTrue(results.get(1).getChangePct() > results.get(2).getChangePct());
    }

    @Test
    void waccShockTest_shouldAddIncreaseToDerivedWacc() {
        Company company = TestFixtures.company();

        StressTestResult result = service.waccShockTest(company, List.of(0.02), assumptions).get(0);

        double expected = dcf.dcfValuation(company, DcfOverrides.builder().wacc(dcf.calculateWacc(company) + 0.02).build())
                .getValue();
        assertEquals(expected, result.getStressedValue(), 1e-3);
        assertEquals(dcf.calculateWacc(company) + 0.02, (Double) result.getDetails().get("stressedWacc"), 1e-12);
    }

    @Test
    void growthSlowdownTest_shouldMultiplyGrowthByFactor() {
        StressTestResult result = service.growthSlowdownTest(TestFixtures.company(), List.of(0.5), assumptions).get(0);

        assertEquals(0.075, (Double) result.getDetails().get("stressedGrowth"), 1e-12);
        assertTrue(result.getChangePct() < 0);
    }

    @Test
    void extremeMarketCrash_shouldCombineShocks() {
        StressTestResult crash = service.extremeMarketCrash(TestFixtures.company(),
                new StressTestProperties().toShocks(), assumptions);

        assertEquals(StressTestService.EXTREME_CRASH, crash.getTestName());
        assertEquals(600_000_000.0, (Double) crash.getDetails().get("stressedRevenue"), 1e-3);
        assertEquals(0.10, (Double) crash.getDetails().get("stressedMargin"), 1e-12);
        assertTrue(crash.getChangePct() < -0.4);
    }

    @Test
    void generateStressReport_shouldReportWorstDiscreteChange() {
        StressReport report = service.generateStressReport(TestFixtures.company(), 99L);

        double worst = report.getExtremeCrash().getChangePct();
        for (List<StressTestResult> group : List.of(report.getRevenueShock(), report.getMarginCompression(),
                report.getWaccShock(), report.getGrowthSlowdown())) {
            for (StressTestResult result : group) {
                worst = Math.min(worst, result.getChangePct());
            }
        }
        assertEquals(worst, report.getMaxDownside(), 1e-12);
        assertEquals(3, report.getRevenueShock().size());
        assertEquals(99L, report.getMonteCarlo().getSeed());
        assertEquals(1_000, report.getMonteCarlo().getIterations());
    }
}
