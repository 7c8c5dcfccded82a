package com.rkflow.caseengine.api.dto;

import com.rkflow.caseengine.service.TransitionResult;

import java.util.List;

/**
 * Response body for POST /cases/{id}/status.
 *
 * closedCaseIds lets the UI refresh sibling cases that were closed by an award.
 */
public record TransitionResponse(long insertId, String msg, List<Long> closedCaseIds) {

    public static TransitionResponse from(TransitionResult result) {
        return new TransitionResponse(result.historyId(), result.message(), result.closedCaseIds());
    }
}
