package com.valuation.riskengine.domain.service.stress;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.stress")
public class StressTestProperties {

    private List<Double> revenueShocks = List.of(-0.30, -0.20, -0.10);
    private List<Double> marginCompressions = List.of(0.05, 0.10, 0.15);
    private List<Double> waccShocks = List.of(0.01, 0.02, 0.03);
    private List<Double> growthSlowdownFactors = List.of(0.3, 0.5, 0.7);

    private double crashRevenueShock = -0.40;
    private double crashMarginCompression = 0.10;
    private double crashWaccShock = 0.03;

    public StressShocks toShocks() {
        return new StressShocks(revenueShocks, marginCompressions, waccShocks, growthSlowdownFactors,
                crashRevenueShock, crashMarginCompression, crashWaccShock);
    }
}
