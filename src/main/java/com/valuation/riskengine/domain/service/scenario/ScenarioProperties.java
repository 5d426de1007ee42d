package com.valuation.riskengine.domain.service.scenario;

import com.valuation.riskengine.domain.model.ScenarioConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.scenario")
public class ScenarioProperties {

    private Deltas bull = new Deltas(0.20, 0.05, -0.01, 0.005);
    private Deltas bear = new Deltas(-0.20, -0.05, 0.02, -0.005);

    /** Base, bull and bear, in that order. */
    public List<ScenarioConfig> defaultScenarios() {
        return List.of(ScenarioConfig.base(), bull.toConfig("bull"), bear.toConfig("bear"));
    }

    @Getter
    @Setter
    public static class Deltas {
        private double revenueGrowthAdj;
        private double marginAdj;
        private double waccAdj;
        private double terminalGrowthAdj;

        public Deltas() {
        }

        public Deltas(double revenueGrowthAdj, double marginAdj, double waccAdj, double terminalGrowthAdj) {
            this.revenueGrowthAdj = revenueGrowthAdj;
            this.marginAdj = marginAdj;
            this.waccAdj = waccAdj;
            this.terminalGrowthAdj = terminalGrowthAdj;
        }

        ScenarioConfig toConfig(String name) {
            return ScenarioConfig.builder()
                    .name(name)
                    .revenueGrowthAdj(revenueGrowthAdj)
                    .marginAdj(marginAdj)
                    .waccAdj(waccAdj)
                    .terminalGrowthAdj(terminalGrowthAdj)
                    .build();
        }
    }
}
