package com.valuation.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Peer company as delivered by a market data source. Any multiple may be
 * null (negative earnings, missing quote, endpoint that does not publish it).
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComparableCompany {

    private final String tsCode;
    private final String name;
    private final String industry;

    private final Double marketCap;
    private final Double revenue;
    private final Double netIncome;
    private final Double netAssets;
    private final Double ebitda;
    private final Double growthRate;

    private final Double peRatio;
    private final Double psRatio;
    private final Double pbRatio;
    private final Double evEbitda;

    /**
     * Returns the usable multiple for the method, or null. A quoted multiple
     * wins; otherwise it is derived from market cap and the peer's own
     * metric. Non-positive or non-finite multiples are not usable.
     */
    public Double multipleFor(RelativeMethod method) {
        Double quoted = switch (method) {
            case PE -> peRatio;
            case PS -> psRatio;
            case PB -> pbRatio;
            case EV_EBITDA -> evEbitda;
        };
        if (quoted != null) {
            return usable(quoted) ? quoted : null;
        }
        if (method == RelativeMethod.EV_EBITDA || marketCap == null) {
            return null;
        }
        Double denominator = switch (method) {
            case PE -> netIncome;
            case PS -> revenue;
            case PB -> netAssets;
            default -> null;
        };
        if (denominator == null || denominator <= 0) {
            return null;
        }
        double derived = marketCap / denominator;
        return usable(derived) ? derived : null;
    }

    private static boolean usable(double multiple) {
        return Double.isFinite(multiple) && multiple > 0;
    }
}
