package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@Builder
public class ComprehensiveSensitivity {

    private final double baseValue;
    private final Map<SensitivityParameter, OneWaySensitivity> parameters;
    private final List<TornadoEntry> tornado;
}
