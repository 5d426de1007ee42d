package com.valuation.riskengine.domain.service.relative;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.valuation.riskengine.domain.service.InvalidInputException;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Private-company adjustments to a multiple-implied value. Forward metrics
 * grow earnings and revenue by one year of the company's growth rate before
 * the multiple is applied; the discount and premium scale the result by
 * {@code 1 - illiquidityDiscount + controlPremium}.
 */
@Getter
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelativeValuationOptions {

    public static final RelativeValuationOptions NONE = RelativeValuationOptions.builder().build();

    private final boolean useForwardMetrics;
    private final double illiquidityDiscount;
    private final double controlPremium;

    public double adjustmentFactor() {
        return 1.0 - illiquidityDiscount + controlPremium;
    }

    public RelativeValuationOptions validate() {
        if (!(illiquidityDiscount >= 0 && illiquidityDiscount < 1)) {
            throw new InvalidInputException("illiquidityDiscount",
                    "illiquidityDiscount must be in [0, 1), got " + illiquidityDiscount);
        }
        if (!(controlPremium >= 0 && Double.isFinite(controlPremium))) {
            throw new InvalidInputException("controlPremium",
                    "controlPremium must be >= 0, got " + controlPremium);
        }
        return this;
    }
}
