package com.rkflow.caseengine.status;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

import static com.rkflow.caseengine.status.StatusCatalog.*;

/**
 * Decides whether a case may move from one status to another.
 *
 * Rules are evaluated in order and the first one that applies wins:
 * <ol>
 *   <li>same status: allowed, nothing to do</li>
 *   <li>Onboarding or later never rolls back</li>
 *   <li>Awarded is exclusive per candidate record</li>
 *   <li>a round &gt; 1 adjust/setup/waiting status needs that round's proposal first</li>
 *   <li>same stage and round with a different total: allowed (retotal)</li>
 *   <li>forward moves must follow the pipeline shape ({@link #allowedForward})</li>
 *   <li>backward moves are rollbacks and allowed</li>
 * </ol>
 *
 * Stateless; the caller supplies history and the exclusivity probe.
 */
@Component
public class TransitionValidator {

    /**
     * @param before           the case's current status
     * @param after            the requested status
     * @param historyStatuses  every status the case has recorded (active or not), plus the current one
     * @param awardedElsewhere true when another active case of the same candidate is at Awarded or above;
     *                         only consulted when after is Awarded
     */
    public TransitionCheck validate(String before,
                                    String after,
                                    Collection<String> historyStatuses,
                                    BooleanSupplier awardedElsewhere) {
        if (after.equals(before)) {
            return TransitionCheck.allow("Status unchanged");
        }

        int beforeLevel = levelOf(before);
        int afterLevel  = levelOf(after);
        StatusMeta beforeMeta = metaOf(before);
        StatusMeta afterMeta  = metaOf(after);

        // 2. Onboarding and beyond are final
        if (beforeLevel >= NO_ROLLBACK_LEVEL && afterLevel < beforeLevel) {
            return TransitionCheck.reject("No rollback past " + ONBOARDING + ": case is at '" + before + "'");
        }

        // 3. exclusivity
        if (AWARDED.equals(after) && awardedElsewhere.getAsBoolean()) {
            return TransitionCheck.reject(
                    "Exclusivity conflict: another active case of the same candidate is already at "
                    + AWARDED + " or later");
        }

        // 4. later rounds need their proposal
        if (afterMeta.isRoundBased()
                && afterMeta.stage() != Stage.PROPOSAL
                && afterMeta.round() > 1
                && !hasRoundProposal(historyStatuses, afterMeta.round())) {
            return TransitionCheck.reject(
                    "'" + after + "' requires a proposal for round " + afterMeta.round() + " first",
                    proposalNamesFor(afterMeta.totalRounds()));
        }

        // 5. retotal in place
        if (afterMeta.sameStageAndRound(beforeMeta)
                && !afterMeta.totalRounds().equals(beforeMeta.totalRounds())) {
            return TransitionCheck.allow("Total rounds adjusted");
        }

        if (afterLevel > beforeLevel) {
            Set<String> forward = allowedForward(before);
            if (forward.contains(after)) {
                return TransitionCheck.allow("Transition allowed");
            }
            if (forward.isEmpty()) {
                return TransitionCheck.reject("'" + before + "' cannot advance any further");
            }
            List<String> options = forward.stream().sorted(BY_LEVEL).toList();
            return TransitionCheck.reject(
                    "'" + before + "' may only advance to: " + String.join(", ", options), options);
        }

        if (afterLevel < beforeLevel) {
            return TransitionCheck.allow("Rollback allowed");
        }

        return TransitionCheck.reject("Invalid transition from '" + before + "' to '" + after + "'");
    }

    /**
     * The pipeline shape: every status reachable by a forward move from status.
     */
    public Set<String> allowedForward(String status) {
        Set<String> allowed = new LinkedHashSet<>();
        StatusMeta meta = metaOf(status);

        switch (meta.stage()) {
            case PROPOSAL -> allowed.addAll(nextInRound(meta, Stage.ADJUST));
            case ADJUST   -> allowed.addAll(nextInRound(meta, Stage.SETUP));
            case SETUP    -> allowed.addAll(nextInRound(meta, Stage.WAITING));
            case WAITING  -> {
                if (meta.round() < meta.totalRounds()) {
                    statusAt(meta.round() + 1, meta.totalRounds(), Stage.PROPOSAL).ifPresent(allowed::add);
                }
                allowed.add(NEGOTIATION);
                allowed.addAll(allProposals());
            }
            case OTHER -> {
                switch (status) {
                    case INIT             -> allowed.add(CONFIRM_PROPOSAL);
                    case CONFIRM_PROPOSAL -> allowed.addAll(namesAt(Stage.PROPOSAL, 1));
                    case NEGOTIATION      -> {
                        allowed.add(AWARDED);
                        allowed.addAll(allProposals());
                    }
                    case AWARDED          -> {
                        allowed.add(ONBOARDING);
                        allowed.addAll(allProposals());
                    }
                    case ONBOARDING       -> allowed.add(STATUS_CHECK);
                    case STATUS_CHECK     -> allowed.add(OFFBOARDING);
                    default               -> { }
                }
            }
        }
        return allowed;
    }

    // Round 1 may switch to any total on the next stage; later rounds keep theirs.
    private static List<String> nextInRound(StatusMeta meta, Stage next) {
        if (meta.round() == 1) {
            return namesAt(next, 1);
        }
        return statusAt(meta.round(), meta.totalRounds(), next).stream().toList();
    }

    // Any proposal of that round counts, whatever total it was recorded under.
    private static boolean hasRoundProposal(Collection<String> historyStatuses, int round) {
        for (String status : historyStatuses) {
            StatusMeta meta = metaOf(status);
            if (meta.stage() == Stage.PROPOSAL && meta.round() == round) {
                return true;
            }
        }
        return false;
    }
}
