package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
public class Recommendation {

    private final double finalValue;
    private final double valueLow;
    private final double valueHigh;
    private final Confidence confidence;
    private final int methodsUsed;
    private final Map<String, Double> methodValues;

    public enum Confidence {
        HIGH, MEDIUM, LOW;

        public static Confidence fromCoefficientOfVariation(double cv) {
            if (cv < 0.1) return HIGH;
            if (cv < 0.2) return MEDIUM;
            return LOW;
        }
    }
}
