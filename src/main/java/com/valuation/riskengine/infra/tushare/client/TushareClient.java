package com.valuation.riskengine.infra.tushare.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuation.riskengine.infra.tushare.config.TushareProperties;
import com.valuation.riskengine.infra.tushare.dto.TushareRequest;
import com.valuation.riskengine.infra.tushare.dto.TushareResponse;
import com.valuation.riskengine.infra.tushare.dto.TushareTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Tushare Pro HTTP API. Every call is a JSON POST to the base URL naming
 * the endpoint in {@code api_name}. Failures are logged and returned as an
 * empty result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TushareClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient okHttpClient;
    private final TushareProperties properties;
    private final ObjectMapper objectMapper;

    public Optional<TushareTable> query(String apiName, Map<String, Object> params, String fields) {
        TushareRequest payload = TushareRequest.builder()
                .apiName(apiName)
                .token(properties.getToken())
                .params(params)
                .fields(fields)
                .build();

        try {
            RequestBody body = RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
            Request request = new Request.Builder().url(properties.getBaseUrl()).post(body).build();

            try (Response response = okHttpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("[Tushare] request failed: api={}, code={}", apiName, response.code());
                    return Optional.empty();
                }

                ResponseBody responseBody = response.body();
                if (responseBody == null) return Optional.empty();

                TushareResponse parsed = objectMapper.readValue(responseBody.string(), TushareResponse.class);
                if (!parsed.isSuccess()) {
                    log.warn("[Tushare] api error: api={}, code={}, msg={}", apiName, parsed.getCode(), parsed.getMsg());
                    return Optional.empty();
                }

                log.debug("[Tushare] response received: api={}, rows={}", apiName, parsed.getData().getItems().size());
                return Optional.of(parsed.getData());
            }
        } catch (Exception e) {
            log.error("[Tushare] request exception: api={}", apiName, e);
            return Optional.empty();
        }
    }
}
