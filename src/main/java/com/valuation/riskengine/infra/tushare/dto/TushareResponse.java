package com.valuation.riskengine.infra.tushare.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

/**
 * Envelope of every Tushare Pro answer. {@code code} 0 means success;
 * anything else carries the reason in {@code msg}.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class TushareResponse {

    private int code;
    private String msg;
    private TushareTable data;

    public boolean isSuccess() {
        return code == 0 && data != null;
    }
}
