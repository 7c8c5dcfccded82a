package com.rkflow.caseengine.service;

import java.util.List;

/**
 * Business failure raised by {@link CaseService}.
 *
 * Unchecked so that any failure inside a @Transactional method rolls back
 * every pending history rewrite and status change. The engine never retries;
 * the kind tells the caller what to do next.
 */
public class CaseServiceException extends RuntimeException {

    public enum Kind {
        VALIDATION,   // illegal transition; see suggestions
        CONFLICT,     // stale before-status: re-fetch and retry
        NOT_FOUND,    // unknown case, history entry, status, or a batch id not owned by the entity
        INPUT         // malformed request value
    }

    private final Kind         kind;
    private final List<String> suggestions;

    public CaseServiceException(Kind kind, String message) {
        this(kind, message, List.of());
    }

    public CaseServiceException(Kind kind, String message, List<String> suggestions) {
        super(message);
        this.kind        = kind;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public Kind         getKind()        { return kind; }
    public List<String> getSuggestions() { return suggestions; }

    static CaseServiceException notFound(String message) {
        return new CaseServiceException(Kind.NOT_FOUND, message);
    }

    static CaseServiceException input(String message) {
        return new CaseServiceException(Kind.INPUT, message);
    }
}
