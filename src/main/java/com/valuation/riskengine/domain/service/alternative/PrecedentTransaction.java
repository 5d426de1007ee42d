package com.valuation.riskengine.domain.service.alternative;

/** A recent deal whose multiple is applied to the target. */
public record PrecedentTransaction(String companyName,
                                   Double dealValue,
                                   Double metricValue,
                                   Double multiple,
                                   String stage) {
}
