package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.ComparableCompany;
import com.valuation.riskengine.domain.model.MultipleStatistics;
import com.valuation.riskengine.domain.model.RelativeMethod;
import com.valuation.riskengine.domain.service.MarketDataSource;
import com.valuation.riskengine.domain.service.relative.RelativeValuationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class MarketDataController {

    private final MarketDataSource marketDataSource;
    private final RelativeValuationService relativeValuationService;

    @GetMapping("/comparables")
    public ResponseEntity<Map<String, Object>> comparables(
            @RequestParam String industry,
            @RequestParam(required = false, defaultValue = "0") int limit) {
        List<ComparableCompany> comparables = marketDataSource.findComparables(industry, limit);
        Map<RelativeMethod, MultipleStatistics> statistics = relativeValuationService.comparableStatistics(comparables);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("industry", industry);
        body.put("count", comparables.size());
        body.put("comparables", comparables);
        body.put("statistics", statistics);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/company/{tsCode}")
    public ResponseEntity<Object> company(@PathVariable String tsCode) {
        String key = tsCode.toUpperCase();
        return marketDataSource.findCompany(key)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of(
                        "success", false,
                        "tsCode", key,
                        "message", "no listed company found for this code")));
    }
}
