package com.valuation.riskengine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuation.riskengine.TestFixtures;
import com.valuation.riskengine.domain.model.Company;
import com.valuation.riskengine.domain.model.ComparableCompany;
import com.valuation.riskengine.domain.service.MarketDataSource;
import com.valuation.riskengine.domain.service.MarketDataUnavailableException;
import com.valuation.riskengine.domain.service.dcf.DcfProperties;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import com.valuation.riskengine.domain.service.history.ValuationHistoryService;
import com.valuation.riskengine.domain.service.relative.RelativeValuationProperties;
import com.valuation.riskengine.domain.service.relative.RelativeValuationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ValuationControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ValuationHistoryService historyService = mock(ValuationHistoryService.class);
    private MockMvc mockMvc;

    /** Serves the shared peers for any industry except "Offline". */
    private static final class FixedMarketData implements MarketDataSource {

        @Override
        public List<ComparableCompany> findComparables(String industry, int limit) {
            if ("Offline".equals(industry)) {
                throw new MarketDataUnavailableException("stock_basic unavailable");
            }
            return TestFixtures.comparables();
        }

        @Override
        public Optional<ComparableCompany> findCompany(String tsCode) {
            return Optional.empty();
        }
    }

    @BeforeEach
    void setUp() {
        DcfValuationService dcf = new DcfValuationService(new DcfProperties());
        RelativeValuationProperties relativeProperties = new RelativeValuationProperties();
        ValuationController controller = new ValuationController(
                new RelativeValuationService(relativeProperties),
                relativeProperties,
                dcf,
                TestFixtures.engine(dcf),
                new FixedMarketData(),
                historyService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private String body(Map<String, Object> fields) throws Exception {
        return objectMapper.writeValueAsString(fields);
    }

    @Test
    void absolute_shouldReturnDcfResult() throws Exception {
        mockMvc.perform(post("/api/valuation/absolute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("company", TestFixtures.company()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("DCF"))
                .andExpect(jsonPath("$.details.horizonYears").value(5));
    }

    @Test
    void absolute_shouldApplyRequestedHorizon() throws Exception {
        Map<String, Object> request = Map.of(
                "company", TestFixtures.company(),
                "assumptions", Map.of("horizonYears", 8));

        mockMvc.perform(post("/api/valuation/absolute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.details.forecasts.length()").value(8));
    }

    @Test
    void absolute_shouldRejectMissingRevenueWithField() throws Exception {
        Company company = TestFixtures.company().toBuilder().revenue(null).build();

        mockMvc.perform(post("/api/valuation/absolute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("company", company))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.field").value("revenue"));
    }

    @Test
    void relative_shouldValueAgainstSuppliedComparables() throws Exception {
        Map<String, Object> request = Map.of(
                "company", TestFixtures.company(),
                "comparables", TestFixtures.comparables());

        mockMvc.perform(post("/api/valuation/relative")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.PE.value").value(1.2e9))
                .andExpect(jsonPath("$.composite.method").value("RELATIVE_COMPOSITE"))
                .andExpect(jsonPath("$.statistics.PE.count").value(3));
    }

    @Test
    void relative_shouldFetchComparablesWhenNoneSupplied() throws Exception {
        mockMvc.perform(post("/api/valuation/relative")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("company", TestFixtures.company()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.comparableCount").value(3));
    }

    @Test
    void relative_shouldReportBadGatewayWhenMarketDataIsDown() throws Exception {
        Company company = TestFixtures.company().toBuilder().industry("Offline").build();

        mockMvc.perform(post("/api/valuation/relative")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(Map.of("company", company))))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void quick_shouldPickMultipleByStage() throws Exception {
        Map<String, Object> request = Map.of(
                "company", TestFixtures.company(),
                "comparables", TestFixtures.comparables());

        mockMvc.perform(post("/api/valuation/quick")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("PE"));
    }

    @Test
    void compare_shouldSkipRiskAnalysis() throws Exception {
        Map<String, Object> request = Map.of(
                "company", TestFixtures.company(),
                "comparables", TestFixtures.comparables());

        mockMvc.perform(post("/api/valuation/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendation.methodsUsed").value(5))
                .andExpect(jsonPath("$.stress").doesNotExist());
    }

    @Test
    void full_shouldRecordReportInHistory() throws Exception {
        when(historyService.record(any())).thenReturn(Optional.of(7L));
        Map<String, Object> request = new HashMap<>();
        request.put("company", TestFixtures.company());
        request.put("comparables", TestFixtures.comparables());
        request.put("riskAnalysis", false);

        mockMvc.perform(post("/api/valuation/full")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.historyId").value(7))
                .andExpect(jsonPath("$.report.companyName").value("Acme Manufacturing"));
        verify(historyService).record(any());
    }
}
