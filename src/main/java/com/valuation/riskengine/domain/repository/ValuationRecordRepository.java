package com.valuation.riskengine.domain.repository;

import com.valuation.riskengine.domain.model.ValuationRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ValuationRecordRepository extends JpaRepository<ValuationRecord, Long> {

    List<ValuationRecord> findByOrderByCreatedAtEpochMsDesc(Pageable pageable);

    List<ValuationRecord> findByCompanyNameOrderByCreatedAtEpochMsDesc(String companyName, Pageable pageable);
}
