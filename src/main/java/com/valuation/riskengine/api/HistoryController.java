package com.valuation.riskengine.api;

import com.valuation.riskengine.domain.model.ValuationRecord;
import com.valuation.riskengine.domain.service.history.ValuationHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class HistoryController {

    private final ValuationHistoryService historyService;

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable long id) {
        return historyService.find(id)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of(
                        "success", false,
                        "id", id,
                        "message", "no valuation recorded under this id")));
    }

    @GetMapping
    public ResponseEntity<List<ValuationRecord>> list(
            @RequestParam(required = false) String company,
            @RequestParam(required = false, defaultValue = "20") int limit) {
        return ResponseEntity.ok(historyService.recent(company, limit));
    }
}
