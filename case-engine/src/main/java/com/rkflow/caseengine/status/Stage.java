package com.rkflow.caseengine.status;

/**
 * Stage of a status inside the round-based middle of the pipeline.
 *
 * Within one interview round the stages run in ordinal order:
 *   PROPOSAL → ADJUST → SETUP → WAITING
 *
 * OTHER covers every status outside the round cycle
 * (Init, Confirm-Proposal, Negotiation, Awarded, ...).
 */
public enum Stage {
    PROPOSAL(0, "Proposal Sent"),
    ADJUST(1, "Interview Scheduling"),
    SETUP(2, "Interview Set"),
    WAITING(3, "Awaiting Result"),
    OTHER(-1, null);

    private final int    order;
    private final String suffix;

    Stage(int order, String suffix) {
        this.order  = order;
        this.suffix = suffix;
    }

    /** Position inside a round; -1 for OTHER. */
    public int order()          { return order; }

    /** Display suffix used to build the round-based status names. */
    String suffix()             { return suffix; }

    public boolean isRoundBased() { return this != OTHER; }
}
