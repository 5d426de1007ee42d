package com.valuation.riskengine.domain.service.sensitivity;

import com.valuation.riskengine.domain.model.SensitivityParameter;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.sensitivity")
public class SensitivityProperties {

    /** Relative half-width of the default sweep around the base value. */
    private double rangePct = 0.20;
    private double minAbsoluteDelta = 0.005;
    private int steps = 5;
    private int twoWaySteps = 5;

    /** Absolute ± change per tornado parameter. */
    private Map<SensitivityParameter, Double> tornadoDeltas = defaultTornadoDeltas();

    public SweepRange defaultRange(double baseValue) {
        return SweepRange.symmetric(baseValue, rangePct, minAbsoluteDelta, steps);
    }

    public SweepRange defaultTwoWayRange(double baseValue) {
        return SweepRange.symmetric(baseValue, rangePct, minAbsoluteDelta, twoWaySteps);
    }

    public double tornadoDelta(SensitivityParameter parameter, double baseValue) {
        Double delta = tornadoDeltas.get(parameter);
        return delta != null ? delta : Math.max(Math.abs(baseValue) * rangePct, minAbsoluteDelta);
    }

    private static Map<SensitivityParameter, Double> defaultTornadoDeltas() {
        Map<SensitivityParameter, Double> deltas = new EnumMap<>(SensitivityParameter.class);
        deltas.put(SensitivityParameter.GROWTH_RATE, 0.10);
        deltas.put(SensitivityParameter.OPERATING_MARGIN, 0.05);
        deltas.put(SensitivityParameter.WACC, 0.01);
        deltas.put(SensitivityParameter.TERMINAL_GROWTH_RATE, 0.005);
        return deltas;
    }
}
