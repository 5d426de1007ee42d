package com.valuation.riskengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Everything one full valuation run produced. Sections that could not be
 * computed are null and explained in {@code warnings}.
 */
@Getter
@Builder
public class ValuationReport {

    private final String companyName;
    private final String industry;
    private final CompanyStage stage;
    private final long timestamp;

    private final Map<RelativeMethod, ValuationResult> relative;
    private final ValuationResult relativeComposite;
    private final ValuationResult dcf;

    private final ScenarioComparison scenario;
    private final StressReport stress;
    private final ComprehensiveSensitivity sensitivity;

    private final Recommendation recommendation;
    private final List<String> warnings;
}
