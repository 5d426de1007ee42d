package com.valuation.riskengine.domain.service.stress.montecarlo;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.MonteCarloResult;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.ValuationException;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Monte Carlo simulation over the DCF kernel. Iterations are cut into
 * fixed-size chunks, each with its own generator split from the root seed in
 * chunk order, so the sampled values do not depend on whether chunks run on
 * the calling thread or the pool.
 */
@Slf4j
@Service
public class MonteCarloSimulationService {

    static final int CHUNK_SIZE = 256;

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
    private static final ExecutorService SIMULATION_POOL = Executors.newFixedThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors()), r -> {
                Thread t = new Thread(r, "mc-simulation-" + THREAD_COUNTER.incrementAndGet());
                t.setDaemon(true);
                return t;
            });

    private final DcfValuationService dcfValuationService;
    private final ValuationDistributionAggregator aggregator;
    private final MonteCarloProperties properties;
    private final Timer durationTimer;
    private final Counter invalidCounter;

    public MonteCarloSimulationService(DcfValuationService dcfValuationService,
                                       ValuationDistributionAggregator aggregator,
                                       MonteCarloProperties properties,
                                       MeterRegistry meterRegistry) {
        this.dcfValuationService = dcfValuationService;
        this.aggregator = aggregator;
        this.properties = properties;
        this.durationTimer = Timer.builder("valuation.montecarlo.duration")
                .description("Monte Carlo simulation wall time")
                .register(meterRegistry);
        this.invalidCounter = Counter.builder("valuation.montecarlo.invalid")
                .description("Iterations without a valid DCF valuation")
                .register(meterRegistry);
    }

    public MonteCarloResult simulate(Company company, Long seed) {
        return simulate(company, properties.defaultRequest(seed), dcfValuationService.defaultAssumptions());
    }

    public MonteCarloResult simulate(Company company, MonteCarloRequest request, DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        List<String> warnings = new ArrayList<>();
        int iterations = effectiveIterations(request.getIterations(), warnings);
        int bins = request.getHistogramBins();
        if (bins < 1) {
            throw new InvalidInputException("histogramBins", "histogramBins must be >= 1, got " + bins);
        }
        long seed = request.getSeed() != null ? request.getSeed() : new SplittableRandom().nextLong();

        BaseParameters base = new BaseParameters(
                company.getGrowthRate(),
                company.resolvedOperatingMargin(),
                dcfValuationService.calculateWacc(company),
                company.getTerminalGrowthRate());
        Map<SampledParameter, ParameterDistribution> distributions =
                request.getDistributions() != null ? request.getDistributions() : Map.of();

        long startNano = System.nanoTime();
        double[] simulated = new double[iterations];

        SplittableRandom root = new SplittableRandom(seed);
        int chunkCount = (iterations + CHUNK_SIZE - 1) / CHUNK_SIZE;
        SplittableRandom[] chunkRngs = new SplittableRandom[chunkCount];
        for (int c = 0; c < chunkCount; c++) {
            chunkRngs[c] = root.split();
        }

        boolean parallel = iterations >= properties.getParallelThreshold() && chunkCount > 1;
        if (parallel) {
            CompletableFuture<?>[] futures = new CompletableFuture<?>[chunkCount];
            for (int c = 0; c < chunkCount; c++) {
                int chunk = c;
                futures[c] = CompletableFuture.runAsync(
                        () -> runChunk(company, assumptions, base, distributions,
                                chunkRngs[chunk], simulated, chunk, iterations),
                        SIMULATION_POOL);
            }
            CompletableFuture.allOf(futures).join();
        } else {
            for (int c = 0; c < chunkCount; c++) {
                runChunk(company, assumptions, base, distributions, chunkRngs[c], simulated, c, iterations);
            }
        }

        long elapsedNanos = System.nanoTime() - startNano;
        durationTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);

        MonteCarloResult result = aggregator.aggregate(simulated, seed, bins, warnings, elapsedNanos / 1_000);
        int invalid = result.getIterations() - result.getValidIterations();
        if (invalid > 0) {
            invalidCounter.increment(invalid);
            log.warn("[MC] degenerate iterations skipped: company={}, invalid={}, iterations={}",
                    company.displayName(), invalid, iterations);
        }

        log.info("[MC] simulation done: company={}, iterations={}, valid={}, parallel={}, mean={}, p5={}, p95={}, elapsed={}μs",
                company.displayName(), iterations, result.getValidIterations(), parallel,
                result.getMean(), result.getPercentile5(), result.getPercentile95(),
                result.getCalcDurationMicros());
        return result;
    }

    private int effectiveIterations(int requested, List<String> warnings) {
        if (requested < 1) {
            throw new InvalidInputException("iterations", "iterations must be >= 1, got " + requested);
        }
        int cap = properties.getMaxIterations();
        if (requested > cap) {
            warnings.add("iterations capped at " + cap + " (requested " + requested + ")");
            log.warn("[MC] iteration count capped: requested={}, cap={}", requested, cap);
            return cap;
        }
        return requested;
    }

    private void runChunk(Company company,
                          DcfAssumptions assumptions,
                          BaseParameters base,
                          Map<SampledParameter, ParameterDistribution> distributions,
                          SplittableRandom rng,
                          double[] out,
                          int chunk,
                          int iterations) {
        int from = chunk * CHUNK_SIZE;
        int to = Math.min(from + CHUNK_SIZE, iterations);
        for (int i = from; i < to; i++) {
            double growth = sample(SampledParameter.GROWTH_RATE, base.growthRate(), distributions, rng);
            double margin = sample(SampledParameter.OPERATING_MARGIN, base.operatingMargin(), distributions, rng);
            double wacc = sample(SampledParameter.WACC, base.wacc(), distributions, rng);
            double terminal = sample(SampledParameter.TERMINAL_GROWTH_RATE, base.terminalGrowthRate(),
                    distributions, rng);

            DcfOverrides overrides = DcfOverrides.builder()
                    .growthRate(growth)
                    .operatingMargin(margin)
                    .wacc(wacc)
                    .terminalGrowthRate(terminal)
                    .build();
            try {
                out[i] = dcfValuationService.dcfValuation(company, overrides, assumptions).getValue();
            } catch (ValuationException e) {
                // counted and reported by the aggregator
                out[i] = Double.NaN;
            }
        }
    }

    private static double sample(SampledParameter parameter,
                                 double baseValue,
                                 Map<SampledParameter, ParameterDistribution> distributions,
                                 SplittableRandom rng) {
        ParameterDistribution distribution = distributions.get(parameter);
        if (distribution == null) {
            return baseValue;
        }
        return parameter.clamp(baseValue + distribution.sample(rng));
    }

    private record BaseParameters(double growthRate, double operatingMargin, double wacc, double terminalGrowthRate) {}
}
