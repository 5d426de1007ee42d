package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.MonteCarloResult;
import com.valuation.riskengine.domain.model.StressReport;
import com.valuation.riskengine.domain.model.StressTestResult;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.stress.StressTestProperties;
import com.valuation.riskengine.domain.service.stress.StressTestService;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloProperties;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloRequest;
import com.valuation.riskengine.domain.service.stress.montecarlo.MonteCarloSimulationService;
import com.valuation.riskengine.domain.service.stress.montecarlo.ParameterDistribution;
import com.valuation.riskengine.domain.service.stress.montecarlo.SampledParameter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/stress-test")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class StressTestController {

    private final StressTestService stressTestService;
    private final StressTestProperties stressProperties;
    private final MonteCarloSimulationService monteCarloSimulationService;
    private final MonteCarloProperties monteCarloProperties;
    private final DcfValuationService dcfValuationService;

    public record RevenueShockRequest(Company company, List<Double> shocks, AssumptionsRequest assumptions) {
    }

    public record MonteCarloApiRequest(Company company,
                                       Long seed,
                                       Integer iterations,
                                       Integer histogramBins,
                                       Map<SampledParameter, ParameterDistribution> distributions,
                                       AssumptionsRequest assumptions) {
    }

    public record FullStressRequest(Company company, Long seed, Integer iterations, AssumptionsRequest assumptions) {
    }

    @PostMapping("/revenue")
    public ResponseEntity<List<StressTestResult>> revenue(@RequestBody RevenueShockRequest request) {
        List<Double> shocks = request.shocks() != null && !request.shocks().isEmpty()
                ? request.shocks()
                : stressProperties.getRevenueShocks();
        return ResponseEntity.ok(stressTestService.revenueShockTest(request.company(), shocks,
                assumptions(request.assumptions())));
    }

    @PostMapping("/monte-carlo")
    public ResponseEntity<MonteCarloResult> monteCarlo(@RequestBody MonteCarloApiRequest request) {
        MonteCarloRequest.MonteCarloRequestBuilder builder =
                monteCarloProperties.defaultRequest(request.seed()).toBuilder();
        if (request.iterations() != null) builder.iterations(request.iterations());
        if (request.histogramBins() != null) builder.histogramBins(request.histogramBins());
        if (request.distributions() != null && !request.distributions().isEmpty()) {
            builder.distributions(request.distributions());
        }

        log.info("[Stress API] monte carlo requested: seed={}, iterations={}", request.seed(), request.iterations());
        return ResponseEntity.ok(monteCarloSimulationService.simulate(request.company(), builder.build(),
                assumptions(request.assumptions())));
    }

    @PostMapping("/full")
    public ResponseEntity<StressReport> full(@RequestBody FullStressRequest request) {
        MonteCarloRequest monteCarlo = monteCarloProperties.defaultRequest(request.seed());
        if (request.iterations() != null) {
            monteCarlo = monteCarlo.toBuilder().iterations(request.iterations()).build();
        }
        return ResponseEntity.ok(stressTestService.generateStressReport(request.company(),
                stressProperties.toShocks(), monteCarlo, assumptions(request.assumptions())));
    }

    private DcfAssumptions assumptions(AssumptionsRequest request) {
        return AssumptionsRequest.resolve(request, dcfValuationService.defaultAssumptions());
    }
}
