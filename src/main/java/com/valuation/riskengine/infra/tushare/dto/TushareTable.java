package com.valuation.riskengine.infra.tushare.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-oriented result table: {@code fields} names the columns,
 * {@code items} holds one list of cell values per row.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class TushareTable {

    private List<String> fields = List.of();
    private List<List<Object>> items = List.of();

    public List<Map<String, Object>> rows() {
        List<Map<String, Object>> rows = new ArrayList<>(items.size());
        for (List<Object> item : items) {
            Map<String, Object> row = new HashMap<>();
            for (int i = 0; i < fields.size() && i < item.size(); i++) {
                row.put(fields.get(i), item.get(i));
            }
            rows.add(row);
        }
        return rows;
    }

    public static Double number(Map<String, Object> row, String field) {
        Object value = row.get(field);
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static String text(Map<String, Object> row, String field) {
        Object value = row.get(field);
        return value != null ? value.toString() : null;
    }
}
