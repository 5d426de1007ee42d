package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ComprehensiveSensitivity;
import com.valuation.riskengine.domain.model.OneWaySensitivity;
import com.valuation.riskengine.domain.model.SensitivityParameter;
import com.valuation.riskengine.domain.model.TornadoEntry;
import com.valuation.riskengine.domain.model.TwoWaySensitivity;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.sensitivity.SensitivityAnalysisService;
import com.valuation.riskengine.domain.service.sensitivity.SensitivityProperties;
import com.valuation.riskengine.domain.service.sensitivity.SweepRange;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sensitivity")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SensitivityController {

    private final SensitivityAnalysisService sensitivityAnalysisService;
    private final SensitivityProperties properties;
    private final DcfValuationService dcfValuationService;

    public record OneWayRequest(Company company,
                                SensitivityParameter parameter,
                                SweepRange range,
                                AssumptionsRequest assumptions) {
    }

    public record TwoWayRequest(Company company,
                                SensitivityParameter rowParameter,
                                SensitivityParameter columnParameter,
                                SweepRange rowRange,
                                SweepRange columnRange,
                                AssumptionsRequest assumptions) {
    }

    public record TornadoRequest(Company company,
                                 Map<SensitivityParameter, Double> deltas,
                                 AssumptionsRequest assumptions) {
    }

    @PostMapping("/one-way")
    public ResponseEntity<OneWaySensitivity> oneWay(@RequestBody OneWayRequest request) {
        if (request.parameter() == null) {
            throw new InvalidInputException("parameter", "parameter is required");
        }
        return ResponseEntity.ok(sensitivityAnalysisService.oneWaySensitivity(request.company(),
                request.parameter(), request.range(), assumptions(request.assumptions())));
    }

    @PostMapping("/two-way")
    public ResponseEntity<TwoWaySensitivity> twoWay(@RequestBody TwoWayRequest request) {
        SensitivityParameter row = request.rowParameter() != null
                ? request.rowParameter() : SensitivityParameter.GROWTH_RATE;
        SensitivityParameter column = request.columnParameter() != null
                ? request.columnParameter() : SensitivityParameter.WACC;
        return ResponseEntity.ok(sensitivityAnalysisService.twoWaySensitivity(request.company(), row, column,
                request.rowRange(), request.columnRange(), assumptions(request.assumptions())));
    }

    @PostMapping("/tornado")
    public ResponseEntity<List<TornadoEntry>> tornado(@RequestBody TornadoRequest request) {
        Map<SensitivityParameter, Double> deltas = request.deltas() != null && !request.deltas().isEmpty()
                ? request.deltas()
                : properties.getTornadoDeltas();
        return ResponseEntity.ok(sensitivityAnalysisService.tornadoChartData(request.company(), deltas,
                assumptions(request.assumptions())));
    }

    @PostMapping("/comprehensive")
    public ResponseEntity<ComprehensiveSensitivity> comprehensive(@RequestBody TornadoRequest request) {
        return ResponseEntity.ok(sensitivityAnalysisService.comprehensiveSensitivity(request.company(),
                assumptions(request.assumptions())));
    }

    private DcfAssumptions assumptions(AssumptionsRequest request) {
        return AssumptionsRequest.resolve(request, dcfValuationService.defaultAssumptions());
    }
}
