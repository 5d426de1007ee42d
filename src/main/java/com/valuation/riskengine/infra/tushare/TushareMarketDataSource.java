package com.valuation.riskengine.infra.tushare;

import com.valuation.riskengine.domain.model.ComparableCompany;
import com.valuation.riskengine.domain.service.InvalidInputException;
import com.valuation.riskengine.domain.service.MarketDataSource;
import com.valuation.riskengine.domain.service.MarketDataUnavailableException;
import com.valuation.riskengine.infra.tushare.client.TushareClient;
import com.valuation.riskengine.infra.tushare.config.TushareProperties;
import com.valuation.riskengine.infra.tushare.dto.TushareTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Comparables from Tushare Pro: listed companies whose industry contains
 * the requested name, largest market cap first, with TTM multiples from
 * {@code daily_basic} and the latest reported revenue, net income and
 * equity. {@code total_mv} is quoted in units of 10,000 CNY and converted to
 * CNY. Tushare publishes no EV/EBITDA, so that multiple stays null.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TushareMarketDataSource implements MarketDataSource {

    static final double MARKET_CAP_UNIT = 10_000.0;
    private static final DateTimeFormatter TRADE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final TushareClient client;
    private final TushareProperties properties;

    @Override
    public List<ComparableCompany> findComparables(String industry, int limit) {
        if (industry == null || industry.isBlank()) {
            throw new InvalidInputException("industry", "industry is required");
        }
        int effectiveLimit = limit > 0 ? limit : properties.getComparableLimit();

        TushareTable basics = client.query("stock_basic",
                        Map.of("list_status", "L"), "ts_code,name,industry")
                .orElseThrow(() -> new MarketDataUnavailableException("stock_basic unavailable"));

        String needle = industry.trim().toLowerCase(Locale.ROOT);
        Map<String, Map<String, Object>> matching = new LinkedHashMap<>();
        for (Map<String, Object> row : basics.rows()) {
            String rowIndustry = TushareTable.text(row, "industry");
            if (rowIndustry != null && rowIndustry.toLowerCase(Locale.ROOT).contains(needle)) {
                matching.put(TushareTable.text(row, "ts_code"), row);
            }
        }
        if (matching.isEmpty()) {
            log.info("[Tushare] no listed company matches industry: industry={}", industry);
            return List.of();
        }

        Map<String, Map<String, Object>> daily = dailyBasics(Map.of("trade_date", latestTradeDate()));

        List<ComparableCompany> candidates = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> entry : matching.entrySet()) {
            Map<String, Object> quote = daily.get(entry.getKey());
            if (quote == null) continue;
            candidates.add(toComparable(entry.getValue(), quote));
        }
        candidates.sort(Comparator.comparing(ComparableCompany::getMarketCap,
                Comparator.nullsLast(Comparator.reverseOrder())));

        List<ComparableCompany> result = new ArrayList<>(Math.min(effectiveLimit, candidates.size()));
        for (ComparableCompany candidate : candidates.subList(0, Math.min(effectiveLimit, candidates.size()))) {
            result.add(withFinancials(candidate));
        }
        log.info("[Tushare] comparables loaded: industry={}, matched={}, returned={}",
                industry, matching.size(), result.size());
        return result;
    }

    @Override
    public Optional<ComparableCompany> findCompany(String tsCode) {
        if (tsCode == null || tsCode.isBlank()) {
            throw new InvalidInputException("tsCode", "tsCode is required");
        }
        TushareTable basics = client.query("stock_basic", Map.of("ts_code", tsCode), "ts_code,name,industry")
                .orElseThrow(() -> new MarketDataUnavailableException("stock_basic unavailable"));
        List<Map<String, Object>> rows = basics.rows();
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> quote = dailyBasics(Map.of("ts_code", tsCode, "trade_date", latestTradeDate()))
                .getOrDefault(tsCode, Map.of());
        return Optional.of(withFinancials(toComparable(rows.get(0), quote)));
    }

    private Map<String, Map<String, Object>> dailyBasics(Map<String, Object> params) {
        TushareTable table = client.query("daily_basic", params, "ts_code,trade_date,pe_ttm,ps_ttm,pb,total_mv")
                .orElseThrow(() -> new MarketDataUnavailableException("daily_basic unavailable"));
        Map<String, Map<String, Object>> byCode = new HashMap<>();
        for (Map<String, Object> row : table.rows()) {
            byCode.put(TushareTable.text(row, "ts_code"), row);
        }
        return byCode;
    }

    /** Last open day of the exchange calendar up to today; today if the calendar is unavailable. */
    String latestTradeDate() {
        String today = LocalDate.now().format(TRADE_DATE);
        Optional<TushareTable> calendar = client.query("trade_cal",
                Map.of("exchange", properties.getExchange(), "is_open", "1", "end_date", today), "cal_date");
        return calendar.map(TushareTable::rows)
                .flatMap(rows -> rows.stream()
                        .map(row -> TushareTable.text(row, "cal_date"))
                        .filter(date -> date != null && date.compareTo(today) <= 0)
                        .max(Comparator.naturalOrder()))
                .orElse(today);
    }

    private ComparableCompany toComparable(Map<String, Object> basic, Map<String, Object> quote) {
        Double totalMv = TushareTable.number(quote, "total_mv");
        return ComparableCompany.builder()
                .tsCode(TushareTable.text(basic, "ts_code"))
                .name(TushareTable.text(basic, "name"))
                .industry(TushareTable.text(basic, "industry"))
                .marketCap(totalMv != null ? totalMv * MARKET_CAP_UNIT : null)
                .peRatio(TushareTable.number(quote, "pe_ttm"))
                .psRatio(TushareTable.number(quote, "ps_ttm"))
                .pbRatio(TushareTable.number(quote, "pb"))
                .build();
    }

    /** Adds the latest statement figures; a missing statement leaves them null. */
    private ComparableCompany withFinancials(ComparableCompany comparable) {
        Map<String, Object> income = latestRow("income", comparable.getTsCode(), "ts_code,revenue,n_income");
        Map<String, Object> balance = latestRow("balancesheet", comparable.getTsCode(),
                "ts_code,total_hldr_eqy_exc_min_int");
        return comparable.toBuilder()
                .revenue(TushareTable.number(income, "revenue"))
                .netIncome(TushareTable.number(income, "n_income"))
                .netAssets(TushareTable.number(balance, "total_hldr_eqy_exc_min_int"))
                .build();
    }

    private Map<String, Object> latestRow(String apiName, String tsCode, String fields) {
        return client.query(apiName, Map.of("ts_code", tsCode, "limit", 1), fields)
                .map(TushareTable::rows)
                .filter(rows -> !rows.isEmpty())
                .map(rows -> rows.get(0))
                .orElseGet(() -> {
                    log.debug("[Tushare] statement missing: api={}, tsCode={}", apiName, tsCode);
                    return Map.of();
                });
    }
}
