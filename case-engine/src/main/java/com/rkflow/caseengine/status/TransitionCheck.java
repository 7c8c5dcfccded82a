package com.rkflow.caseengine.status;

import java.util.List;

/**
 * Outcome of validating one status change.
 *
 * suggestions lists the statuses the caller could pick instead, in level order.
 * It is empty when the change is allowed or when no remediation exists.
 */
public record TransitionCheck(boolean allowed, String reason, List<String> suggestions) {

    public TransitionCheck {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static TransitionCheck allow(String reason) {
        return new TransitionCheck(true, reason, List.of());
    }

    public static TransitionCheck reject(String reason) {
        return new TransitionCheck(false, reason, List.of());
    }

    public static TransitionCheck reject(String reason, List<String> suggestions) {
        return new TransitionCheck(false, reason, suggestions);
    }
}
