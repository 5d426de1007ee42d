package com.valuation.riskengine.domain.service.dcf;

import com.valuation.riskengine.domain.model.TerminalValueMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.dcf")
public class DcfProperties {

    private int horizonYears = 5;
    private double capexRatio = 0.05;
    private double workingCapitalRatio = 0.02;
    private double depreciationRatio = 0.03;
    private double minWaccSpread = 0.001;
    private double exitMultiple = 10.0;
    private TerminalValueMethod terminalMethod = TerminalValueMethod.PERPETUITY_GROWTH;

    public DcfAssumptions toAssumptions() {
        return new DcfAssumptions(horizonYears, capexRatio, workingCapitalRatio,
                depreciationRatio, minWaccSpread, exitMultiple, terminalMethod);
    }
}
