package com.rkflow.caseengine.api;

import com.rkflow.caseengine.api.dto.ErrorResponse;
import com.rkflow.caseengine.service.CaseServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps engine failures to HTTP responses.
 *
 * VALIDATION → 422 (with suggestions), CONFLICT → 409, NOT_FOUND → 404, INPUT → 400.
 */
@RestControllerAdvice
public class CaseExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CaseExceptionHandler.class);

    @ExceptionHandler(CaseServiceException.class)
    public ResponseEntity<ErrorResponse> handleCaseServiceException(CaseServiceException ex) {
        log.warn("Case request failed [{}]: {}", ex.getKind(), ex.getMessage());

        HttpStatus status = switch (ex.getKind()) {
            case VALIDATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONFLICT   -> HttpStatus.CONFLICT;
            case NOT_FOUND  -> HttpStatus.NOT_FOUND;
            case INPUT      -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), ex.getKind().name(), ex.getMessage(), ex.getSuggestions()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(400, "INPUT", "Malformed JSON request body", List.of()));
    }
}
