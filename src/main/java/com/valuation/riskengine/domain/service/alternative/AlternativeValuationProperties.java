package com.valuation.riskengine.domain.service.alternative;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.alternative")
public class AlternativeValuationProperties {

    /** Money-on-money multiple a venture investor targets at exit. */
    private double vcTargetReturnMultiple = 10.0;
    private int vcInvestmentYears = 5;
    private double vcTargetPe = 20.0;
    private double vcMarginImprovement = 0.0;

    private double firstChicagoSuccessProbability = 0.3;

    /** Share of the summed parts lost to corporate overhead. */
    private double sumOfPartsCorporateDiscount = 0.10;

    public VcProjection defaultProjection() {
        return new VcProjection(vcInvestmentYears, vcTargetPe, vcTargetReturnMultiple, vcMarginImprovement);
    }
}
