package com.valuation.riskengine.domain.service.stress.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.montecarlo")
public class MonteCarloProperties {

    private int defaultIterations = 1_000;
    private int maxIterations = 100_000;
    private int histogramBins = 30;
    private int parallelThreshold = 1_000;

    private DistributionType distribution = DistributionType.NORMAL;
    private double growthStd = 0.05;
    private double marginStd = 0.03;
    private double waccStd = 0.01;
    private double terminalGrowthStd = 0.005;

    public Map<SampledParameter, ParameterDistribution> defaultDistributions() {
        Map<SampledParameter, ParameterDistribution> distributions = new EnumMap<>(SampledParameter.class);
        distributions.put(SampledParameter.GROWTH_RATE, new ParameterDistribution(distribution, 0.0, growthStd));
        distributions.put(SampledParameter.OPERATING_MARGIN, new ParameterDistribution(distribution, 0.0, marginStd));
        distributions.put(SampledParameter.WACC, new ParameterDistribution(distribution, 0.0, waccStd));
        distributions.put(SampledParameter.TERMINAL_GROWTH_RATE,
                new ParameterDistribution(distribution, 0.0, terminalGrowthStd));
        return distributions;
    }

    public MonteCarloRequest defaultRequest(Long seed) {
        return MonteCarloRequest.builder()
                .iterations(defaultIterations)
                .seed(seed)
                .distributions(defaultDistributions())
                .histogramBins(histogramBins)
                .build();
    }
}
