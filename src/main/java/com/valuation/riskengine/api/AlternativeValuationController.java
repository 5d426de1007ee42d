package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ValuationResult;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.alternative.AlternativeValuationProperties;
import com.valuation.riskengine.domain.service.alternative.AlternativeValuationService;
import com.valuation.riskengine.domain.service.alternative.BusinessUnit;
import com.valuation.riskengine.domain.service.alternative.PrecedentTransaction;
import com.valuation.riskengine.domain.service.alternative.VcExit;
import com.valuation.riskengine.domain.service.alternative.VcProjection;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/valuation/alternative")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AlternativeValuationController {

    private final AlternativeValuationService alternativeValuationService;
    private final AlternativeValuationProperties properties;

    public record VcRequest(Company company, VcExit exit) {
    }

    public record VcProjectionRequest(Company company,
                                      Integer projectionYears,
                                      Double targetPe,
                                      Double targetReturnMultiple,
                                      Double marginImprovement) {
    }

    public record CostRequest(Company company,
                              Double intangibleAssetValue,
                              Double goodwillValue,
                              Double adjustmentFactor) {
    }

    public record AdjustedNetAssetRequest(Company company,
                                          Map<String, Double> assetAdjustments,
                                          Map<String, Double> liabilityAdjustments) {
    }

    public record TransactionRequest(Company company, List<PrecedentTransaction> transactions) {
    }

    public record FirstChicagoRequest(Double successValue, Double failureValue, Double probabilityOfSuccess) {
    }

    public record SumOfPartsRequest(List<BusinessUnit> businessUnits) {
    }

    @PostMapping("/vc")
    public ResponseEntity<ValuationResult> vc(@RequestBody VcRequest request) {
        return ResponseEntity.ok(alternativeValuationService.vcMethod(request.company(), request.exit()));
    }

    @PostMapping("/vc-projection")
    public ResponseEntity<ValuationResult> vcProjection(@RequestBody VcProjectionRequest request) {
        VcProjection defaults = properties.defaultProjection();
        VcProjection projection = new VcProjection(
                request.projectionYears() != null ? request.projectionYears() : defaults.projectionYears(),
                request.targetPe() != null ? request.targetPe() : defaults.targetPe(),
                request.targetReturnMultiple() != null ? request.targetReturnMultiple() : defaults.targetReturnMultiple(),
                request.marginImprovement() != null ? request.marginImprovement() : defaults.marginImprovement());
        return ResponseEntity.ok(alternativeValuationService.vcWithProjection(request.company(), projection));
    }

    @PostMapping("/cost")
    public ResponseEntity<ValuationResult> cost(@RequestBody CostRequest request) {
        return ResponseEntity.ok(alternativeValuationService.costMethod(request.company(),
                request.intangibleAssetValue() != null ? request.intangibleAssetValue() : 0.0,
                request.goodwillValue() != null ? request.goodwillValue() : 0.0,
                request.adjustmentFactor() != null ? request.adjustmentFactor() : 1.0));
    }

    @PostMapping("/adjusted-net-asset")
    public ResponseEntity<ValuationResult> adjustedNetAsset(@RequestBody AdjustedNetAssetRequest request) {
        return ResponseEntity.ok(alternativeValuationService.adjustedNetAssetMethod(request.company(),
                request.assetAdjustments(), request.liabilityAdjustments()));
    }

    @PostMapping("/transactions")
    public ResponseEntity<ValuationResult> transactions(@RequestBody TransactionRequest request) {
        return ResponseEntity.ok(alternativeValuationService.transactionComparable(request.company(),
                request.transactions()));
    }

    @PostMapping("/first-chicago")
    public ResponseEntity<ValuationResult> firstChicago(@RequestBody FirstChicagoRequest request) {
        if (request.successValue() == null || request.failureValue() == null) {
            throw new InvalidInputException("successValue", "successValue and failureValue are required");
        }
        double probability = request.probabilityOfSuccess() != null
                ? request.probabilityOfSuccess()
                : properties.getFirstChicagoSuccessProbability();
        return ResponseEntity.ok(alternativeValuationService.firstChicago(request.successValue(),
                request.failureValue(), probability));
    }

    @PostMapping("/sum-of-parts")
    public ResponseEntity<ValuationResult> sumOfParts(@RequestBody SumOfPartsRequest request) {
        return ResponseEntity.ok(alternativeValuationService.sumOfParts(request.businessUnits()));
    }
}
