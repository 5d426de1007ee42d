package com.valuation.riskengine.domain.service.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuation.riskengine.domain.model.ValuationRecord;
import com.valuation.riskengine.domain.model.ValuationReport;
import com.valuation.riskengine.domain.repository.ValuationRecordRepository;
import com.valuation.riskengine.domain.service.dcf.DcfValuationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Stores full valuation reports. Recording is best effort: a failure is
 * logged and reported as an empty id, never thrown back into the valuation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationHistoryService {

    static final int MAX_PAGE_SIZE = 100;

    private final ValuationRecordRepository repository;
    private final ObjectMapper objectMapper;

    public Optional<Long> record(ValuationReport report) {
        if (report == null) return Optional.empty();
        try {
            ValuationRecord saved = repository.save(ValuationRecord.builder()
                    .companyName(report.getCompanyName())
                    .industry(report.getIndustry())
                    .stage(report.getStage() != null ? report.getStage().name() : null)
                    .dcfValue(report.getDcf() != null ? report.getDcf().getValue() : null)
                    .dcfWacc(report.getDcf() != null ? report.getDcf().detailAsDouble(DcfValuationService.DETAIL_WACC) : null)
                    .finalValue(report.getRecommendation() != null ? report.getRecommendation().getFinalValue() : null)
                    .relativeMethodCount(report.getRelative() != null ? report.getRelative().size() : 0)
                    .payloadJson(objectMapper.writeValueAsString(report))
                    .createdAtEpochMs(report.getTimestamp() > 0 ? report.getTimestamp() : System.currentTimeMillis())
                    .build());
            log.debug("[History] valuation recorded: id={}, company={}", saved.getId(), saved.getCompanyName());
            return Optional.of(saved.getId());
        } catch (JsonProcessingException e) {
            log.warn("[History] report serialization failed, not recorded: company={}", report.getCompanyName(), e);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("[History] persistence failed, not recorded: company={}", report.getCompanyName(), e);
            return Optional.empty();
        }
    }

    public Optional<ValuationRecord> find(long id) {
        return repository.findById(id);
    }

    /** Newest first, optionally for one company. */
    public List<ValuationRecord> recent(String companyName, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_PAGE_SIZE)));
        if (companyName == null || companyName.isBlank()) {
            return repository.findByOrderByCreatedAtEpochMsDesc(page);
        }
        return repository.findByCompanyNameOrderByCreatedAtEpochMsDesc(companyName, page);
    }
}
