package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ProbabilityWeightedValuation;
import com.valuation.riskengine.domain.model.ScenarioComparison;
import com.valuation.riskengine.domain.model.ScenarioConfig;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.scenario.ScenarioAnalysisService;
import com.valuation.riskengine.domain.service.scenario.WeightedScenario;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/scenario")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ScenarioController {

    private final ScenarioAnalysisService scenarioAnalysisService;
    private final DcfValuationService dcfValuationService;

    public record AnalyzeRequest(Company company, List<ScenarioConfig> scenarios, AssumptionsRequest assumptions) {
    }

    public record ProbabilityRequest(Company company, List<WeightedScenario> scenarios, AssumptionsRequest assumptions) {
    }

    @PostMapping("/analyze")
    public ResponseEntity<ScenarioComparison> analyze(@RequestBody AnalyzeRequest request) {
        return ResponseEntity.ok(scenarioAnalysisService.compareScenarios(request.company(), request.scenarios(),
                AssumptionsRequest.resolve(request.assumptions(), dcfValuationService.defaultAssumptions())));
    }

    @PostMapping("/probability")
    public ResponseEntity<ProbabilityWeightedValuation> probability(@RequestBody ProbabilityRequest request) {
        return ResponseEntity.ok(scenarioAnalysisService.probabilityWeighted(request.company(), request.scenarios(),
                AssumptionsRequest.resolve(request.assumptions(), dcfValuationService.defaultAssumptions())));
    }
}
