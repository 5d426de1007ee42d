package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.service.MarketDataUnavailableException;
import com.valuation.riskengine.domain.service.ValuationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine failures to the {@code {success:false, message, field}} body
 * every endpoint uses for errors.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValuationException.class)
    public ResponseEntity<Map<String, Object>> handleValuation(ValuationException e) {
        log.warn("[API] valuation rejected: field={}, reason={}", e.getField(), e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getMessage(), e.getField()));
    }

    /** Record and value-object constructors validate while Jackson binds the body. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof ValuationException valuation) {
                return handleValuation(valuation);
            }
            cause = cause.getCause();
        }
        log.warn("[API] malformed request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error("malformed request body", null));
    }

    @ExceptionHandler(MarketDataUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleMarketData(MarketDataUnavailableException e) {
        log.error("[API] market data unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error(e.getMessage(), null));
    }

    private static Map<String, Object> error(String message, String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        body.put("field", field);
        return body;
    }
}
