package com.valuation.riskengine.api;

import com.valuation.riskengine.TestFixtures;
import com.valuation.riskengine.domain.model.ComparableCompany;
import com.valuation.riskengine.domain.model.ValuationRecord;
import com.valuation.riskengine.domain.service.MarketDataSource;
import com.valuation.riskengine.domain.service.MarketDataUnavailableException;
import com.valuation.riskengine.domain.service.history.ValuationHistoryService;
import com.valuation.riskengine.domain.service.relative.RelativeValuationProperties;
import com.valuation.riskengine.domain.service.relative.RelativeValuationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MarketAndHistoryControllersTest {

    private final MarketDataSource marketDataSource = mock(MarketDataSource.class);
    private final ValuationHistoryService historyService = mock(ValuationHistoryService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new MarketDataController(marketDataSource,
                                new RelativeValuationService(new RelativeValuationProperties())),
                        new HistoryController(historyService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void comparables_shouldReturnPeersWithStatistics() throws Exception {
        when(marketDataSource.findComparables("Machinery", 0)).thenReturn(TestFixtures.comparables());

        mockMvc.perform(get("/api/market/comparables").param("industry", "Machinery"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.industry").value("Machinery"))
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.comparables[0].tsCode").value("600001.SH"))
                .andExpect(jsonPath("$.statistics.PE.median").value(12.0));
    }

    @Test
    void comparables_shouldPassLimitThrough() throws Exception {
        when(marketDataSource.findComparables("Machinery", 2)).thenReturn(TestFixtures.comparables().subList(0, 2));

        mockMvc.perform(get("/api/market/comparables").param("industry", "Machinery").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2));
        verify(marketDataSource).findComparables("Machinery", 2);
    }

    @Test
    void comparables_shouldMapUnavailableSourceToBadGateway() throws Exception {
        when(marketDataSource.findComparables("Machinery", 0))
                .thenThrow(new MarketDataUnavailableException("daily_basic unavailable"));

        mockMvc.perform(get("/api/market/comparables").param("industry", "Machinery"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void company_shouldUppercaseCode() throws Exception {
        when(marketDataSource.findCompany("600519.SH")).thenReturn(Optional.of(
                ComparableCompany.builder().tsCode("600519.SH").name("Kweichow Moutai").peRatio(30.0).build()));

        mockMvc.perform(get("/api/market/company/600519.sh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Kweichow Moutai"));
    }

    @Test
    void company_shouldReturnNotFoundForUnknownCode() throws Exception {
        when(marketDataSource.findCompany("000000.SZ")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/market/company/000000.SZ"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.tsCode").value("000000.SZ"));
    }

    @Test
    void history_shouldReturnRecordById() throws Exception {
        ValuationRecord record = ValuationRecord.builder()
                .id(3L)
                .companyName("Acme Manufacturing")
                .finalValue(1.5e9)
                .createdAtEpochMs(1_700_000_000_000L)
                .build();
        when(historyService.find(3L)).thenReturn(Optional.of(record));

        mockMvc.perform(get("/api/history/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.companyName").value("Acme Manufacturing"))
                .andExpect(jsonPath("$.finalValue").value(1.5e9));
    }

    @Test
    void history_shouldReturnNotFoundForMissingId() throws Exception {
        when(historyService.find(99L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/history/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.id").value(99));
    }

    @Test
    void history_shouldListRecentForCompany() throws Exception {
        when(historyService.recent("Acme Manufacturing", 5)).thenReturn(List.of(
                ValuationRecord.builder().id(2L).companyName("Acme Manufacturing").build(),
                ValuationRecord.builder().id(1L).companyName("Acme Manufacturing").build()));

        mockMvc.perform(get("/api/history").param("company", "Acme Manufacturing").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(2));
    }
}
