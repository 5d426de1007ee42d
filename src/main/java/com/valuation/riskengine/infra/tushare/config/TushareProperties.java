package com.valuation.riskengine.infra.tushare.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "tushare")
public class TushareProperties {

    private String baseUrl = "http://api.tushare.pro";

    private String token = "";

    private int comparableLimit = 20;

    private String exchange = "SSE";

    private long connectTimeoutSeconds = 10;

    private long readTimeoutSeconds = 30;
}
