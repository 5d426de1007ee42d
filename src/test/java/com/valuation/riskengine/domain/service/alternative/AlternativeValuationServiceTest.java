package com.valuation.riskengine.domain.service.alternative;

import com.valuation.riskengine.TestFixtures;
import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.CompanyStage;
import com.valuation.riskengine.domain.model.RelativeMethod;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.DegenerateModelException;
import com.valuation.riskengine.domain.service.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlternativeValuationServiceTest {

    private final AlternativeValuationService service =
            new AlternativeValuationService(new AlternativeValuationProperties());

    private static Company earlyStage() {
        return TestFixtures.company().toBuilder()
                .stage(CompanyStage.EARLY)
                .revenue(20_000_000.0)
                .netIncome(-5_000_000.0)
                .netAssets(30_000_000.0)
                .growthRate(0.5)
                .build();
    }

    @Test
    void vcWithProjection_shouldCapitaliseGrownEarnings() {
        ValuationResult result = service.vcWithProjection(TestFixtures.company(), new VcProjection(5, 25.0, 15.0, 0.0));

        double futureNetIncome = 100_000_000.0 * Math.pow(1.15, 5);
        assertEquals(AlternativeValuationService.METHOD_VC_PROJECTION, result.getMethod());
        assertEquals(futureNetIncome, result.detailAsDouble("futureNetIncome"), 1e-3);
        assertEquals(futureNetIncome * 25.0, result.detailAsDouble("exitValuation"), 1e-2);
        assertEquals(futureNetIncome * 25.0 / 15.0, result.getValue(), 1e-2);
        assertEquals(Math.pow(15.0, 0.2) - 1, result.detailAsDouble("impliedIrr"), 1e-12);
    }

    @Test
    void vcWithProjection_shouldCompoundMarginImprovement() {
        double flat = service.vcWithProjection(TestFixtures.company(), new VcProjection(3, 20.0, 10.0, 0.0)).getValue();
        double improving = service.vcWithProjection(TestFixtures.company(), new VcProjection(3, 20.0, 10.0, 0.1)).getValue();

        assertEquals(flat * Math.pow(1.1, 3), improving, 1e-3);
    }

    @Test
    void vcWithProjection_shouldRejectLossMaker() {
        DegenerateModelException e = assertThrows(DegenerateModelException.class,
                () -> service.vcWithProjection(earlyStage()));

        assertEquals("netIncome", e.getField());
    }

    @Test
    void vcProjection_shouldRejectNonPositiveReturnMultiple() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new VcProjection(5, 20.0, 0.0, 0.0));

        assertEquals("targetReturnMultiple", e.getField());
    }

    @Test
    void vcMethod_shouldDivideGivenExitValue() {
        ValuationResult result = service.vcMethod(earlyStage(), new VcExit(2_000_000_000.0, 20.0, 4, null, null));

        assertEquals(100_000_000.0, result.getValue(), 1e-6);
        assertEquals(Math.pow(20.0, 0.25) - 1, result.detailAsDouble("impliedIrr"), 1e-12);
        assertEquals(false, result.getDetails().get("exitProjected"));
    }

    @Test
    void vcMethod_shouldProjectRevenueWithPsExitMultiple() {
        ValuationResult result = service.vcMethod(earlyStage(),
                new VcExit(null, 10.0, 5, RelativeMethod.PS, 4.0));

        double exit = 20_000_000.0 * Math.pow(1.5, 5) * 4.0;
        assertEquals(exit, result.detailAsDouble("exitValuation"), 1e-3);
        assertEquals(exit / 10.0, result.getValue(), 1e-3);
        assertEquals(true, result.getDetails().get("exitProjected"));
    }

    @Test
    void vcMethod_shouldRequireExitValueWhenEarningsCannotBeProjected() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.vcMethod(earlyStage(), new VcExit(null, null, null, RelativeMethod.PE, 20.0)));

        assertEquals("exitValuation", e.getField());
    }

    @Test
    void costMethod_shouldAddIntangiblesAndScale() {
        ValuationResult result = service.costMethod(TestFixtures.company(), 50_000_000.0, 20_000_000.0, 0.9);

        assertEquals(AlternativeValuationService.METHOD_COST, result.getMethod());
        assertEquals(570_000_000.0 * 0.9, result.getValue(), 1e-3);
        assertEquals(513_000_000.0 / 500_000_000.0, result.detailAsDouble("priceToBook"), 1e-12);
    }

    @Test
    void costMethod_shouldRequireNetAssets() {
        Company noBook = TestFixtures.company().toBuilder().netAssets(null).build();

        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.costMethod(noBook, 0.0, 0.0, 1.0));
        assertEquals("netAssets", e.getField());
    }

    @Test
    void adjustedNetAssetMethod_shouldApplyFairValueAdjustments() {
        ValuationResult result = service.adjustedNetAssetMethod(TestFixtures.company(),
                Map.of("land", 80_000_000.0, "inventory", -10_000_000.0),
                Map.of("pension", 30_000_000.0));

        assertEquals(540_000_000.0, result.getValue(), 1e-3);
        assertEquals(70_000_000.0, result.detailAsDouble("totalAssetAdjustment"), 1e-3);
        assertEquals(30_000_000.0, result.detailAsDouble("totalLiabilityAdjustment"), 1e-3);
    }

    @Test
    void adjustedNetAssetMethod_shouldTreatMissingAdjustmentsAsZero() {
        ValuationResult result = service.adjustedNetAssetMethod(TestFixtures.company(), null, null);

        assertEquals(500_000_000.0, result.getValue(), 1e-6);
    }

    @Test
    void transactionComparable_shouldApplyMedianMultipleToNetIncome() {
        List<PrecedentTransaction> deals = List.of(
                new PrecedentTransaction("Deal A", 1_200_000_000.0, 60_000_000.0, 20.0, "B"),
                new PrecedentTransaction("Deal B", 800_000_000.0, 40_000_000.0, 20.0, "B"),
                new PrecedentTransaction("Deal C", 1_500_000_000.0, 50_000_000.0, 30.0, "C"),
                new PrecedentTransaction("Deal D", null, null, null, "C"));

        ValuationResult result = service.transactionComparable(TestFixtures.company(), deals);

        assertEquals(AlternativeValuationService.METHOD_TRANSACTION, result.getMethod());
        assertEquals(2_000_000_000.0, result.getValue(), 1e-3);
        assertEquals(2_000_000_000.0, result.getValueLow(), 1e-3);
        assertEquals(3_000_000_000.0, result.getValueHigh(), 1e-3);
        assertEquals("netIncome", result.getDetails().get("metricUsed"));
        assertEquals(4, result.getDetails().get("transactionCount"));
        assertEquals(3, result.getDetails().get("usableMultiples"));
    }

    @Test
    void transactionComparable_shouldUseRevenueForLossMaker() {
        ValuationResult result = service.transactionComparable(earlyStage(),
                List.of(new PrecedentTransaction("Deal A", null, null, 3.0, "A")));

        assertEquals("revenue", result.getDetails().get("metricUsed"));
        assertEquals(60_000_000.0, result.getValue(), 1e-6);
    }

    @Test
    void transactionComparable_shouldRejectDealsWithoutMultiples() {
        assertThrows(InvalidInputException.class, () -> service.transactionComparable(TestFixtures.company(),
                List.of(new PrecedentTransaction("Deal A", 1.0, 1.0, null, "A"))));
        assertThrows(InvalidInputException.class,
                () -> service.transactionComparable(TestFixtures.company(), List.of()));
    }

    @Test
    void firstChicago_shouldWeightSuccessAndFailure() {
        ValuationResult result = service.firstChicago(2_000_000_000.0, 100_000_000.0);

        assertEquals(AlternativeValuationService.METHOD_FIRST_CHICAGO, result.getMethod());
        assertEquals(2_000_000_000.0 * 0.3 + 100_000_000.0 * 0.7, result.getValue(), 1e-3);
        assertEquals(100_000_000.0, result.getValueLow(), 0.0);
        assertEquals(2_000_000_000.0, result.getValueHigh(), 0.0);
    }

    @Test
    void firstChicago_shouldRejectProbabilityOutsideUnitInterval() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.firstChicago(1.0, 0.0, 1.5));

        assertEquals("probabilityOfSuccess", e.getField());
    }

    @Test
    void sumOfParts_shouldSumUnitsAndApplyCorporateDiscount() {
        ValuationResult result = service.sumOfParts(List.of(
                new BusinessUnit("Cloud", 100_000_000.0, 5.0, null),
                new BusinessUnit("Hardware", null, null, 300_000_000.0),
                new BusinessUnit("Pipeline", null, 8.0, null)));

        assertEquals(AlternativeValuationService.METHOD_SUM_OF_PARTS, result.getMethod());
        assertEquals(800_000_000.0, result.detailAsDouble("partsValue"), 1e-3);
        assertEquals(80_000_000.0, result.detailAsDouble("corporateDiscount"), 1e-3);
        assertEquals(720_000_000.0, result.getValue(), 1e-3);
        assertEquals(2, ((List<?>) result.getDetails().get("businessUnits")).size());
    }

    @Test
    void sumOfParts_shouldRejectWhenNoUnitCanBeValued() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.sumOfParts(List.of(new BusinessUnit("Idea", null, null, null))));

        assertEquals("businessUnits", e.getField());
    }
}
