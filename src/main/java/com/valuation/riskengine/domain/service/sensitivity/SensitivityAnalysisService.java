package com.valuation.riskengine.domain.service.sensitivity;

import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ComprehensiveSensitivity;
import com.valuation.riskengine.domain.model.OneWaySensitivity;
import com.valuation.riskengine.domain.model.SensitivityParameter;
import com.valuation.riskengine.domain.model.TornadoEntry;
import com.valuation.riskengine.domain.model.TwoWaySensitivity;
import com.valuation.riskengine.domain.service.CompanyValidator;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.ValuationException;
import com.valuation.riskengine.domain.service.dcf.DcfAssumptions;
import com.valuation.riskengine.domain.service.dcf.DcfOverrides;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Parameter sweeps over the DCF kernel. A sweep point whose DCF is
 * degenerate is recorded as null and left out of min, max and range.
 * {@code impactPercentage} is the valuation range over the absolute base
 * DCF value (0 when the base value is 0).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SensitivityAnalysisService {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
    private static final ExecutorService SWEEP_POOL = Executors.newFixedThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors()), r -> {
                Thread t = new Thread(r, "sensitivity-sweep-" + THREAD_COUNTER.incrementAndGet());
                t.setDaemon(true);
                return t;
            });

    private final DcfValuationService dcfValuationService;
    private final SensitivityProperties properties;

    public OneWaySensitivity oneWaySensitivity(Company company, SensitivityParameter parameter) {
        return oneWaySensitivity(company, parameter, null, dcfValuationService.defaultAssumptions());
    }

    /**
     * @param range explicit sweep, or null for the configured symmetric
     *              sweep around the parameter's base value
     */
    public OneWaySensitivity oneWaySensitivity(Company company,
                                               SensitivityParameter parameter,
                                               SweepRange range,
                                               DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        double baseDcf = baseDcf(company, assumptions);
        double baseParameter = dcfValuationService.baseParameterValue(company, parameter);
        SweepRange sweep = range != null ? range : properties.defaultRange(baseParameter);

        List<Double> points = sweep.points();
        List<Double> valuations = new ArrayList<>(points.size());
        for (double point : points) {
            valuations.add(evaluate(company, DcfOverrides.NONE.with(parameter, point), assumptions));
        }

        Double min = valuations.stream().filter(Objects::nonNull).min(Double::compare).orElse(null);
        Double max = valuations.stream().filter(Objects::nonNull).max(Double::compare).orElse(null);
        double valuationRange = min != null ? max - min : 0.0;

        OneWaySensitivity result = OneWaySensitivity.builder()
                .parameter(parameter)
                .baseParameterValue(baseParameter)
                .parameterValues(points)
                .valuations(valuations)
                .minValuation(min)
                .maxValuation(max)
                .valuationRange(valuationRange)
                .baseValue(baseDcf)
                .impactPercentage(impact(valuationRange, baseDcf))
                .elasticity(elasticity(points, valuations, baseParameter, baseDcf))
                .build();

        log.debug("[Sensitivity] one-way done: company={}, parameter={}, points={}, range={}",
                company.displayName(), parameter, points.size(), valuationRange);
        return result;
    }

    public TwoWaySensitivity twoWaySensitivity(Company company,
                                               SensitivityParameter rowParameter,
                                               SensitivityParameter columnParameter) {
        return twoWaySensitivity(company, rowParameter, columnParameter, null, null,
                dcfValuationService.defaultAssumptions());
    }

    /**
     * Grid over two parameters. Rows are evaluated in parallel; each cell is
     * an independent DCF call.
     */
    public TwoWaySensitivity twoWaySensitivity(Company company,
                                               SensitivityParameter rowParameter,
                                               SensitivityParameter columnParameter,
                                               SweepRange rowRange,
                                               SweepRange columnRange,
                                               DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        if (rowParameter == columnParameter) {
            throw new InvalidInputException("columnParameter",
                    "two-way sensitivity needs two different parameters, got " + rowParameter + " twice");
        }
        SweepRange rows = rowRange != null ? rowRange
                : properties.defaultTwoWayRange(dcfValuationService.baseParameterValue(company, rowParameter));
        SweepRange columns = columnRange != null ? columnRange
                : properties.defaultTwoWayRange(dcfValuationService.baseParameterValue(company, columnParameter));

        List<Double> rowValues = rows.points();
        List<Double> columnValues = columns.points();
        Double[][] grid = new Double[rowValues.size()][columnValues.size()];

        CompletableFuture<?>[] futures = new CompletableFuture<?>[rowValues.size()];
        for (int i = 0; i < rowValues.size(); i++) {
            int row = i;
            futures[i] = CompletableFuture.runAsync(() -> {
                DcfOverrides rowOverrides = DcfOverrides.NONE.with(rowParameter, rowValues.get(row));
                for (int j = 0; j < columnValues.size(); j++) {
                    grid[row][j] = evaluate(company,
                            rowOverrides.with(columnParameter, columnValues.get(j)), assumptions);
                }
            }, SWEEP_POOL);
        }
        CompletableFuture.allOf(futures).join();

        List<List<Double>> matrix = new ArrayList<>(grid.length);
        Double min = null;
        Double max = null;
        for (Double[] row : grid) {
            matrix.add(Collections.unmodifiableList(Arrays.asList(row)));
            for (Double v : row) {
                if (v == null) continue;
                min = min == null ? v : Math.min(min, v);
                max = max == null ? v : Math.max(max, v);
            }
        }

        log.info("[Sensitivity] two-way done: company={}, rows={}({}), columns={}({}), min={}, max={}",
                company.displayName(), rowParameter, rowValues.size(),
                columnParameter, columnValues.size(), min, max);
        return TwoWaySensitivity.builder()
                .rowParameter(rowParameter)
                .columnParameter(columnParameter)
                .rowValues(rowValues)
                .columnValues(columnValues)
                .matrix(matrix)
                .minValuation(min)
                .maxValuation(max)
                .build();
    }

    public List<TornadoEntry> tornadoChartData(Company company) {
        return tornadoChartData(company, properties.getTornadoDeltas(), dcfValuationService.defaultAssumptions());
    }

    /**
     * Moves each standard parameter down and up by its delta and ranks the
     * parameters by the resulting valuation range, widest first. Equal
     * ranges keep the standard parameter order.
     */
    public List<TornadoEntry> tornadoChartData(Company company,
                                               Map<SensitivityParameter, Double> deltas,
                                               DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        List<TornadoEntry> entries = new ArrayList<>(SensitivityParameter.STANDARD.size());
        for (SensitivityParameter parameter : SensitivityParameter.STANDARD) {
            double base = dcfValuationService.baseParameterValue(company, parameter);
            Double configured = deltas != null ? deltas.get(parameter) : null;
            double delta = configured != null ? configured : properties.tornadoDelta(parameter, base);
            if (!(delta >= 0) || !Double.isFinite(delta)) {
                throw new InvalidInputException("delta", "tornado delta for " + parameter + " must be >= 0");
            }

            OneWaySensitivity sweep = oneWaySensitivity(company, parameter,
                    new SweepRange(base - delta, base + delta, 3), assumptions);
            List<Double> valuations = sweep.getValuations();
            entries.add(new TornadoEntry(
                    parameter,
                    base - delta,
                    base + delta,
                    valuations.get(0),
                    valuations.get(valuations.size() - 1),
                    sweep.getValuationRange(),
                    sweep.getImpactPercentage()));
        }
        entries.sort(Comparator.comparingDouble(TornadoEntry::valuationRange).reversed());
        return List.copyOf(entries);
    }

    public ComprehensiveSensitivity comprehensiveSensitivity(Company company) {
        return comprehensiveSensitivity(company, dcfValuationService.defaultAssumptions());
    }

    public ComprehensiveSensitivity comprehensiveSensitivity(Company company, DcfAssumptions assumptions) {
        CompanyValidator.validate(company);
        double baseDcf = baseDcf(company, assumptions);

        Map<SensitivityParameter, OneWaySensitivity> parameters = new EnumMap<>(SensitivityParameter.class);
        for (SensitivityParameter parameter : SensitivityParameter.STANDARD) {
            parameters.put(parameter, oneWaySensitivity(company, parameter, null, assumptions));
        }
        List<TornadoEntry> tornado = tornadoChartData(company, properties.getTornadoDeltas(), assumptions);

        log.info("[Sensitivity] comprehensive done: company={}, base={}, top={}",
                company.displayName(), baseDcf, tornado.isEmpty() ? null : tornado.get(0).parameter());
        return ComprehensiveSensitivity.builder()
                .baseValue(baseDcf)
                .parameters(parameters)
                .tornado(tornado)
                .build();
    }

    private double baseDcf(Company company, DcfAssumptions assumptions) {
        return dcfValuationService.dcfValuation(company, DcfOverrides.NONE, assumptions).getValue();
    }

    private Double evaluate(Company company, DcfOverrides overrides, DcfAssumptions assumptions) {
        try {
            return dcfValuationService.dcfValuation(company, overrides, assumptions).getValue();
        } catch (ValuationException e) {
            log.debug("[Sensitivity] degenerate sweep point: company={}, field={}, reason={}",
                    company.displayName(), e.getField(), e.getMessage());
            return null;
        }
    }

    private static double impact(double valuationRange, double baseDcf) {
        return baseDcf != 0.0 ? valuationRange / Math.abs(baseDcf) : 0.0;
    }

    /**
     * Relative value change between the outermost valid points over the
     * relative parameter change between them.
     */
    private static Double elasticity(List<Double> points, List<Double> valuations,
                                     double baseParameter, double baseDcf) {
        int first = -1;
        int last = -1;
        for (int i = 0; i < valuations.size(); i++) {
            if (valuations.get(i) != null) {
                if (first < 0) first = i;
                last = i;
            }
        }
        if (first < 0 || first == last || baseDcf == 0.0 || baseParameter == 0.0) {
            return null;
        }
        double valueChange = (valuations.get(last) - valuations.get(first)) / baseDcf;
        double parameterChange = (points.get(last) - points.get(first)) / baseParameter;
        return parameterChange != 0.0 ? valueChange / parameterChange : null;
    }
}
