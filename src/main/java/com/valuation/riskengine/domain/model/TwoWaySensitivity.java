package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Heat-map grid: {@code matrix.get(i).get(j)} is the value at
 * {@code rowValues[i]} and {@code columnValues[j]}, or null when degenerate.
 */
@Getter
@Builder
public class TwoWaySensitivity {

    private final SensitivityParameter rowParameter;
    private final SensitivityParameter columnParameter;
    private final List<Double> rowValues;
    private final List<Double> columnValues;
    private final List<List<Double>> matrix;
    private final Double minValuation;
    private final Double maxValuation;
}
