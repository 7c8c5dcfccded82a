package com.rkflow.caseengine.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A case: one candidate record (supply) proposed for one job requisition (demand).
 *
 * The case carries a single pipeline status at a time. Its full trail lives in
 * {@link CaseHistoryEntry}. Cases are never deleted; an inactive case has been
 * closed, either manually or because a sibling case was awarded.
 *
 * DB table: rk_supply_demand_link  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "rk_supply_demand_link")
public class SupplyDemandCase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // The candidate record. Exclusivity is enforced across all cases sharing it.
    @Column(name = "supply_id")
    private Long supplyId;

    @Column(name = "demand_id")
    private Long demandId;

    @Column(name = "current_status", length = 50)
    private String currentStatus;

    @Column(nullable = false)
    private boolean active = true;

    // Why the case was closed automatically, shown to recruiters.
    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "to_be_confirmed", nullable = false)
    private boolean toBeConfirmed = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected SupplyDemandCase() {}   // required by JPA

    public SupplyDemandCase(Long supplyId, Long demandId, String currentStatus) {
        this.supplyId      = supplyId;
        this.demandId      = demandId;
        this.currentStatus = currentStatus;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long    getId()            { return id; }
    public Long    getSupplyId()      { return supplyId; }
    public Long    getDemandId()      { return demandId; }
    public String  getCurrentStatus() { return currentStatus; }
    public boolean isActive()         { return active; }
    public String  getReason()        { return reason; }
    public boolean isToBeConfirmed()  { return toBeConfirmed; }
    public Instant getCreatedAt()     { return createdAt; }
    public Instant getUpdatedAt()     { return updatedAt; }

    public void setCurrentStatus(String currentStatus) { this.currentStatus = currentStatus; }
    public void setActive(boolean active)               { this.active = active; }
    public void setReason(String reason)                { this.reason = reason; }
    public void setToBeConfirmed(boolean v)             { this.toBeConfirmed = v; }
}
