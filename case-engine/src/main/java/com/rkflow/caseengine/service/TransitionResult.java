package com.rkflow.caseengine.service;

import java.util.List;

/**
 * Result of an applied transition.
 *
 * @param historyId     id of the history entry inserted or updated; 0 for a no-op
 * @param message       newline-joined log of the side effects on sibling cases and the candidate record
 * @param closedCaseIds sibling cases closed because this case reached Awarded
 */
public record TransitionResult(long historyId, String message, List<Long> closedCaseIds) {

    public TransitionResult {
        closedCaseIds = List.copyOf(closedCaseIds);
    }

    public static TransitionResult noop() {
        return new TransitionResult(0L, "", List.of());
    }
}
