package com.rkflow.caseengine.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed case request.
 *
 * suggestions is filled for rejected transitions only.
 */
public record ErrorResponse(
        int          status,
        String       error,
        String       message,
        List<String> suggestions,
        Instant      timestamp
) {
    public ErrorResponse(int status, String error, String message, List<String> suggestions) {
        this(status, error, message, suggestions, Instant.now());
    }
}
