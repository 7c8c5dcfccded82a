package com.rkflow.caseengine.api.dto;

/**
 * Request body for POST /cases/status-check.
 *
 * caseId is null for a case that has not been created yet.
 */
public record StatusCheckRequest(Long caseId, String beforeStatus, String afterStatus) {}
