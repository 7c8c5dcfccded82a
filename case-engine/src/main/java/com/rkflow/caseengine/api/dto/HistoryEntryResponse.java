package com.rkflow.caseengine.api.dto;

import com.rkflow.caseengine.model.CaseHistoryEntry;

import java.time.Instant;

/**
 * Read-only view of one history entry returned by GET /cases/{id}/history.
 */
public record HistoryEntryResponse(
        Long    id,
        Long    caseId,
        long    seq,
        String  status,
        String  remark,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public static HistoryEntryResponse from(CaseHistoryEntry e) {
        return new HistoryEntryResponse(
                e.getId(),
                e.getCaseId(),
                e.getSeq(),
                e.getStatus(),
                e.getRemark(),
                e.isActive(),
                e.getCreatedAt(),
                e.getUpdatedAt()
        );
    }
}
