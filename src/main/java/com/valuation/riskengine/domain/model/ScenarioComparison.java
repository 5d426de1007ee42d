package com.valuation.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scenario name to outcome, plus distribution statistics. Serialised as one
 * flat object where {@value #STATISTICS_KEY} is a reserved key next to the
 * scenario names; {@link #getScenarios()} never contains it.
 */
public class ScenarioComparison {

    public static final String STATISTICS_KEY = "statistics";

    private final Map<String, ScenarioOutcome> scenarios;
    private final ScenarioStatistics statistics;
    private final List<String> failedScenarios;

    public ScenarioComparison(Map<String, ScenarioOutcome> scenarios,
                              ScenarioStatistics statistics,
                              List<String> failedScenarios) {
        this.scenarios = Collections.unmodifiableMap(new LinkedHashMap<>(scenarios));
        this.statistics = statistics;
        this.failedScenarios = List.copyOf(failedScenarios);
    }

    @JsonAnyGetter
    public Map<String, ScenarioOutcome> getScenarios() {
        return scenarios;
    }

    @JsonProperty(STATISTICS_KEY)
    public ScenarioStatistics getStatistics() {
        return statistics;
    }

    @JsonIgnore
    public List<String> getFailedScenarios() {
        return failedScenarios;
    }
}
