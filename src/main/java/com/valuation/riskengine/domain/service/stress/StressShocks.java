package com.valuation.riskengine.domain.service.stress;

import com.valuation.riskengine.domain.service.InvalidInputException;

import java.util.List;

/**
 * Shock levels for one stress report. Revenue shocks are signed fractions of
 * base revenue, margin compressions are subtracted percentage points, WACC
 * shocks are added to the derived rate and growth slowdown factors multiply
 * the growth rate.
 */
public record StressShocks(
        List<Double> revenueShocks,
        List<Double> marginCompressions,
        List<Double> waccShocks,
        List<Double> growthSlowdownFactors,
        double crashRevenueShock,
        double crashMarginCompression,
        double crashWaccShock
) {

    public StressShocks {
        revenueShocks = List.copyOf(requireLevels("revenueShocks", revenueShocks));
        marginCompressions = List.copyOf(requireLevels("marginCompressions", marginCompressions));
        waccShocks = List.copyOf(requireLevels("waccShocks", waccShocks));
        growthSlowdownFactors = List.copyOf(requireLevels("growthSlowdownFactors", growthSlowdownFactors));
        for (Double shock : revenueShocks) {
            requireRevenueShock(shock);
        }
        requireRevenueShock(crashRevenueShock);
    }

    /** Every level must be present and finite. */
    static List<Double> requireLevels(String field, List<Double> levels) {
        if (levels == null) {
            throw new InvalidInputException(field, field + " is required");
        }
        for (int i = 0; i < levels.size(); i++) {
            Double level = levels.get(i);
            if (level == null || !Double.isFinite(level)) {
                throw new InvalidInputException(field, field + "[" + i + "] must be a finite number, got " + level);
            }
        }
        return levels;
    }

    static void requireRevenueShock(double shock) {
        if (!(shock >= -1.0) || !Double.isFinite(shock)) {
            throw new InvalidInputException("revenueShock",
                    "revenue shock must be a finite fraction >= -1, got " + shock);
        }
    }
}
