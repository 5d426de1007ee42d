package com.valuation.riskengine.domain.service.relative;

import com.valuation.riskengine.domain.model.RelativeMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.relative")
public class RelativeValuationProperties {

    private Map<RelativeMethod, Double> weights = defaultWeights();

    /** Applied to the auto analysis when a request carries no options. */
    private double illiquidityDiscount = 0.0;
    private double controlPremium = 0.0;
    private boolean useForwardMetrics = false;

    public RelativeValuationOptions defaultOptions() {
        return RelativeValuationOptions.builder()
                .useForwardMetrics(useForwardMetrics)
                .illiquidityDiscount(illiquidityDiscount)
                .controlPremium(controlPremium)
                .build();
    }

    private static Map<RelativeMethod, Double> defaultWeights() {
        Map<RelativeMethod, Double> weights = new EnumMap<>(RelativeMethod.class);
        weights.put(RelativeMethod.PE, 0.3);
        weights.put(RelativeMethod.PS, 0.3);
        weights.put(RelativeMethod.PB, 0.2);
        weights.put(RelativeMethod.EV_EBITDA, 0.2);
        return weights;
    }
}
