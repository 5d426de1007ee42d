package com.valuation.riskengine.domain.service.sensitivity;

import com.valuation.riskengine.TestFixtures;
import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ComprehensiveSensitivity;
import com.valuation.riskengine.domain.model.OneWaySensitivity;
import com.valuation.riskengine.domain.model.SensitivityParameter;
import com.valuation.riskengine.domain.model.TornadoEntry;
import com.valuation.riskengine.domain.model.TwoWaySensitivity;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfProperties;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SensitivityAnalysisServiceTest {

    private final DcfValuationService dcf = new DcfValuationService(new DcfProperties());
    private final SensitivityAnalysisService service = new SensitivityAnalysisService(dcf, new SensitivityProperties());

    @Test
    void oneWaySensitivity_shouldSweepSymmetricallyAroundBase() {
        OneWaySensitivity result = service.oneWaySensitivity(TestFixtures.company(), SensitivityParameter.GROWTH_RATE);

        assertEquals(5, result.getParameterValues().size());
        assertEquals(0.15, result.getBaseParameterValue(), 1e-12);
        assertEquals(0.12, result.getParameterValues().get(0), 1e-12);
        assertEquals(0.15, result.getParameterValues().get(2), 1e-12);
        assertEquals(0.18, result.getParameterValues().get(4), 1e-12);
    }

    @Test
    void oneWaySensitivity_shouldReportRangeBetweenSweepEnds() {
        Company company = TestFixtures.company();

        OneWaySensitivity result = service.oneWaySensitivity(company, SensitivityParameter.WACC,
                new SweepRange(0.08, 0.12, 5), dcf.defaultAssumptions());

        double atLow = dcf.dcfValuation(company, DcfOverrides.builder().wacc(0.08).build()).getValue();
        double atHigh = dcf.dcfValuation(company, DcfOverrides.builder().wacc(0.12).build()).getValue();
        assertEquals(Math.abs(atHigh - atLow), result.getValuationRange(), 1e-3);
        assertEquals(atLow, result.getMaxValuation(), 1e-3);
        assertEquals(atHigh, result.getMinValuation(), 1e-3);
        assertEquals(result.getValuationRange() / Math.abs(result.getBaseValue()), result.getImpactPercentage(), 1e-12);
    }

    @Test
    void oneWaySensitivity_shouldRecordDegeneratePointsAsNull() {
        OneWaySensitivity result = service.oneWaySensitivity(TestFixtures.company(), SensitivityParameter.WACC,
                new SweepRange(0.01, 0.10, 4), dcf.defaultAssumptions());

        assertNull(result.getValuations().get(0));
        assertNotNull(result.getValuations().get(3));
        assertTrue(result.getValuationRange() > 0);
    }

    @Test
    void oneWaySensitivity_shouldRejectInvertedRange() {
        assertThrows(InvalidInputException.class, () -> new SweepRange(0.2, 0.1, 3));
    }

    @Test
    void twoWaySensitivity_shouldFillGridWithCombinedOverrides() {
        Company company = TestFixtures.company();

        TwoWaySensitivity grid = service.twoWaySensitivity(company,
                SensitivityParameter.GROWTH_RATE, SensitivityParameter.WACC);

        assertEquals(5, grid.getMatrix().size());
        assertEquals(5, grid.getMatrix().get(0).size());
        double growth = grid.getRowValues().get(1);
        double wacc = grid.getColumnValues().get(3);
        double expected = dcf.dcfValuation(company, DcfOverrides.builder().growthRate(growth).wacc(wacc).build())
                .getValue();
        assertEquals(expected, grid.getMatrix().get(1).get(3), 1e-3);
    }

    @Test
    void twoWaySensitivity_shouldRejectSameParameterTwice() {
        assertThrows(InvalidInputException.class, () -> service.twoWaySensitivity(TestFixtures.company(),
                SensitivityParameter.WACC, SensitivityParameter.WACC));
    }

    @Test
    void tornadoChartData_shouldRankParametersByRangeDescending() {
        List<TornadoEntry> tornado = service.tornadoChartData(TestFixtures.company());

        assertEquals(4, tornado.size());
        for (int i = 1; i < tornado.size(); i++) {
            assertTrue(tornado.get(i - 1).valuationRange() >= tornado.get(i).valuationRange());
        }
    }

    @Test
    void tornadoChartData_shouldMoveEachParameterByItsDelta() {
        TornadoEntry wacc = service.tornadoChartData(TestFixtures.company()).stream()
                .filter(entry -> entry.parameter() == SensitivityParameter.WACC)
                .findFirst()
                .orElseThrow();

        double base = dcf.calculateWacc(TestFixtures.company());
        assertEquals(base - 0.01, wacc.lowParameterValue(), 1e-12);
        assertEquals(base + 0.01, wacc.highParameterValue(), 1e-12);
        assertTrue(wacc.valueAtLow() > wacc.valueAtHigh());
    }

    @Test
    void comprehensiveSensitivity_shouldCoverStandardParameters() {
        ComprehensiveSensitivity result = service.comprehensiveSensitivity(TestFixtures.company());

        assertEquals(SensitivityParameter.STANDARD.size(), result.getParameters().size());
        assertEquals(4, result.getTornado().size());
        assertEquals(dcf.dcfValuation(TestFixtures.company()).getValue(), result.getBaseValue(), 1e-6);
    }
}
