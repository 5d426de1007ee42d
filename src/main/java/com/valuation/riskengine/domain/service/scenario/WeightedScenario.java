package com.valuation.riskengine.domain.service.scenario;

import com.valuation.riskengine.domain.model.ScenarioConfig;

public record WeightedScenario(ScenarioConfig scenario, double probability) {}
