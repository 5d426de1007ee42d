package com.valuation.riskengine.domain.service.sensitivity;

import com.valuation.riskengine.domain.service.InvalidInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Evenly spaced sweep from {@code low} to {@code high}, both inclusive.
 */
public record SweepRange(double low, double high, int steps) {

    public SweepRange {
        if (!Double.isFinite(low) || !Double.isFinite(high)) {
            throw new InvalidInputException("range", "sweep bounds must be finite");
        }
        if (low > high) {
            throw new InvalidInputException("range", "sweep low (" + low + ") is above high (" + high + ")");
        }
        if (steps < 2) {
            throw new InvalidInputException("steps", "a sweep needs at least 2 steps, got " + steps);
        }
    }

    /**
     * {@code base ± max(|base| * pct, minDelta)}. An odd step count puts the
     * base value on the grid.
     */
    public static SweepRange symmetric(double base, double pct, double minDelta, int steps) {
        double delta = Math.max(Math.abs(base) * pct, minDelta);
        return new SweepRange(base - delta, base + delta, steps);
    }

    public List<Double> points() {
        List<Double> points = new ArrayList<>(steps);
        double step = (high - low) / (steps - 1);
        for (int i = 0; i < steps; i++) {
            points.add(i == steps - 1 ? high : low + i * step);
        }
        return points;
    }
}
