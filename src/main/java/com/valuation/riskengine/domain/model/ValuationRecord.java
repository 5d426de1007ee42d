package com.valuation.riskengine.domain.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "valuation_record", indexes = {
        @Index(name = "idx_valuation_record_company", columnList = "companyName"),
        @Index(name = "idx_valuation_record_created", columnList = "createdAtEpochMs")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValuationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String companyName;
    private String industry;
    private String stage;

    private Double dcfValue;
    private Double dcfWacc;
    private Double finalValue;
    private int relativeMethodCount;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String payloadJson;

    private long createdAtEpochMs;
}
