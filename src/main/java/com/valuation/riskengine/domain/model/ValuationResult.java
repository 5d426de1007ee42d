package com.valuation.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one valuation call. {@code value} is always the equity value;
 * method-specific diagnostics live in {@code details}. Immutable after
 * construction.
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValuationResult {

    private final String method;
    private final double value;
    private final Double valueLow;
    private final Double valueHigh;
    private final Map<String, Object> details;
    private final Map<String, Object> assumptions;

    @Builder
    public ValuationResult(String method,
                           double value,
                           Double valueLow,
                           Double valueHigh,
                           Map<String, Object> details,
                           Map<String, Object> assumptions) {
        this.method = method;
        this.value = value;
        this.valueLow = valueLow;
        this.valueHigh = valueHigh;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.assumptions = assumptions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(assumptions));
    }

    public double getValueMid() {
        if (valueLow != null && valueHigh != null) {
            return (valueLow + valueHigh) / 2;
        }
        return value;
    }

    public Double getRangeWidthPct() {
        double mid = getValueMid();
        if (valueLow == null || valueHigh == null || mid <= 0) {
            return null;
        }
        return (valueHigh - valueLow) / mid;
    }

    public double detailAsDouble(String key) {
        Object raw = details.get(key);
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalStateException("detail '" + key + "' is not numeric in " + method + " result");
    }
}
