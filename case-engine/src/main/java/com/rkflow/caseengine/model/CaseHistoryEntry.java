package com.rkflow.caseengine.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One entry in a case's append-only status log.
 *
 * Entries are ordered by seq, a per-case counter assigned on insert. Rewrites
 * may relabel an entry's status (round renumbering) and rollbacks deactivate
 * entries, but rows are never deleted.
 *
 * DB table: rk_case_status  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "rk_case_status")
public class CaseHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "case_id", nullable = false)
    private Long caseId;

    // Monotonic per case; the only ordering key for history.
    @Column(nullable = false)
    private long seq;

    @Column(nullable = false, length = 50)
    private String status;

    @Column(length = 500)
    private String remark = "";

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected CaseHistoryEntry() {}   // required by JPA

    public CaseHistoryEntry(Long caseId, long seq, String status, String remark) {
        this.caseId = caseId;
        this.seq    = seq;
        this.status = status;
        this.remark = remark == null ? "" : remark;
    }

    public Long    getId()        { return id; }
    public Long    getCaseId()    { return caseId; }
    public long    getSeq()       { return seq; }
    public String  getStatus()    { return status; }
    public String  getRemark()    { return remark; }
    public boolean isActive()     { return active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setStatus(String status)  { this.status = status; }
    public void setRemark(String remark)  { this.remark = remark; }
    public void setActive(boolean active) { this.active = active; }
}
