package com.rkflow.caseengine.api.dto;

/**
 * Request body for POST /cases/{id}/status.
 *
 * beforeStatus is the status the caller last saw; the change is refused
 * if the case has moved since.
 */
public record StatusChangeRequest(String beforeStatus, String afterStatus) {}
