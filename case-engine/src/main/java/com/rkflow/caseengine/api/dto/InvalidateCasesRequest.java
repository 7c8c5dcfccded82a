package com.rkflow.caseengine.api.dto;

import java.util.List;

/**
 * Request body for POST /cases/invalidate.
 *
 * ownerTable is "rk_supply" or "rk_demand"; every case id must belong to ownerId there.
 */
public record InvalidateCasesRequest(List<Long> caseIds, Long ownerId, String ownerTable) {

    public InvalidateCasesRequest {
        if (caseIds == null) caseIds = List.of();
    }
}
