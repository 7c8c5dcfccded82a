package com.rkflow.caseengine.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * The candidate record side of a case, reduced to what the engine touches:
 * the aggregate case status shown on the candidate list.
 *
 * DB table: rk_supply  (owned by the supply module; V1 creates the columns used here)
 */
@Entity
@Table(name = "rk_supply")
public class SupplyRecord {

    @Id
    private Long id;

    // Highest-level status among the candidate's active cases.
    @Column(name = "case_status", length = 50)
    private String caseStatus;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected SupplyRecord() {}   // required by JPA

    public SupplyRecord(Long id) {
        this.id = id;
    }

    public Long   getId()         { return id; }
    public String getCaseStatus() { return caseStatus; }

    public void setCaseStatus(String caseStatus) { this.caseStatus = caseStatus; }
}
