package com.rkflow.caseengine.repository;

import com.rkflow.caseengine.model.CaseHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * CRUD + ordered reads for the rk_case_status table.
 */
public interface CaseHistoryRepository extends JpaRepository<CaseHistoryEntry, Long> {

    /** Full history of a case, oldest first. */
    List<CaseHistoryEntry> findByCaseIdOrderBySeqAsc(Long caseId);

    List<CaseHistoryEntry> findByCaseIdAndActiveTrueOrderBySeqAsc(Long caseId);

    /**
     * Highest seq recorded for a case, 0 when it has none.
     * Must be called inside the transaction that inserts the next entry.
     */
    @Query("SELECT COALESCE(MAX(h.seq), 0) FROM CaseHistoryEntry h WHERE h.caseId = :caseId")
    long maxSeq(@Param("caseId") Long caseId);
}
