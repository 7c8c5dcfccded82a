package com.rkflow.caseengine.status;

/**
 * Round metadata of a status name.
 *
 * round and totalRounds are null for stage OTHER.
 */
public record StatusMeta(Stage stage, Integer round, Integer totalRounds) {

    public static final StatusMeta OTHER = new StatusMeta(Stage.OTHER, null, null);

    public boolean isRoundBased() {
        return stage.isRoundBased();
    }

    /** Same round-based stage and same round, regardless of the total. */
    public boolean sameStageAndRound(StatusMeta other) {
        return isRoundBased()
                && stage == other.stage
                && round.equals(other.round);
    }
}
