package com.valuation.riskengine.infra.tushare.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
public class TushareRequest {

    @JsonProperty("api_name")
    private final String apiName;

    private final String token;

    @Builder.Default
    private final Map<String, Object> params = Map.of();

    /** Comma-separated column list. */
    private final String fields;
}
