package com.rkflow.caseengine.repository;

import com.rkflow.caseengine.model.CaseHistoryEntry;
import com.rkflow.caseengine.model.CaseOwner;
import com.rkflow.caseengine.model.SupplyDemandCase;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port of the transition engine.
 *
 * The engine reads and writes cases, their history and the candidate's
 * aggregate status only through this interface. Implementations must run
 * inside the caller's transaction; they never commit on their own.
 */
public interface CaseStore {

    Optional<SupplyDemandCase> findCase(Long caseId);

    /** Persist status / active / reason / pending-confirmation changes on a case. */
    SupplyDemandCase saveCase(SupplyDemandCase supplyDemandCase);

    /** Cases of one candidate record with the given active flag, in id order. */
    List<SupplyDemandCase> findCasesBySupply(Long supplyId, boolean active);

    /** The subset of caseIds listed under ownerId in the owner's table. */
    List<SupplyDemandCase> findCasesForOwner(Collection<Long> caseIds, Long ownerId, CaseOwner owner);

    /** History of a case in seq order; only active entries when activeOnly is set. */
    List<CaseHistoryEntry> listHistory(Long caseId, boolean activeOnly);

    Optional<CaseHistoryEntry> findHistory(Long historyId);

    /** Append an active entry with the next seq for the case. */
    CaseHistoryEntry insertHistory(Long caseId, String status, String remark);

    /** Persist status / remark / active changes on an existing entry. */
    CaseHistoryEntry saveHistory(CaseHistoryEntry entry);

    Optional<String> findAggregateStatus(Long supplyId);

    /**
     * Store the candidate's aggregate status.
     *
     * @return false when no candidate row exists for supplyId; nothing is written then
     */
    boolean updateAggregateStatus(Long supplyId, String status);
}
