package com.rkflow.caseengine.service;

import com.rkflow.caseengine.model.CaseHistoryEntry;
import com.rkflow.caseengine.model.CaseOwner;
import com.rkflow.caseengine.model.SupplyDemandCase;
import com.rkflow.caseengine.repository.CaseStore;
import com.rkflow.caseengine.service.CaseServiceException.Kind;
import com.rkflow.caseengine.status.HistoryRewriter;
import com.rkflow.caseengine.status.Stage;
import com.rkflow.caseengine.status.StatusMeta;
import com.rkflow.caseengine.status.TransitionCheck;
import com.rkflow.caseengine.status.TransitionValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.rkflow.caseengine.status.StatusCatalog.*;

/**
 * Applies status changes to cases.
 *
 * Every public method that writes is @Transactional: validation, history
 * rewrites, the case update and the sibling/aggregate side effects commit
 * together or not at all. Concurrent writers on one case are serialized by
 * the before-status check in {@link #applyTransition}, not by locks.
 */
@Service
public class CaseService {

    private static final Logger log = LoggerFactory.getLogger(CaseService.class);

    private static final List<String> INITIAL_STATUSES = List.of(INIT, CONFIRM_PROPOSAL);

    private final CaseStore           store;
    private final TransitionValidator validator;
    private final HistoryRewriter     rewriter;
    private final MeterRegistry       meterRegistry;
    private final int                 remarkMaxLength;

    public CaseService(CaseStore store,
                       TransitionValidator validator,
                       HistoryRewriter rewriter,
                       MeterRegistry meterRegistry,
                       @Value("${caseengine.history.remark-max-length:500}") int remarkMaxLength) {
        this.store           = store;
        this.validator       = validator;
        this.rewriter        = rewriter;
        this.meterRegistry   = meterRegistry;
        this.remarkMaxLength = remarkMaxLength;
    }

    // ------------------------------------------------------------------
    // Preflight
    // ------------------------------------------------------------------

    /**
     * Check a status change without writing anything.
     *
     * With no caseId the case does not exist yet and may only start at
     * Awaiting Confirmation or Proposal Check.
     */
    @Transactional(readOnly = true)
    public TransitionCheck preflightCheck(Long caseId, String before, String after) {
        if (caseId == null) {
            if (after == null || !INITIAL_STATUSES.contains(after)) {
                return TransitionCheck.reject(
                        "A new case may only start at '" + INIT + "' or '" + CONFIRM_PROPOSAL + "'",
                        INITIAL_STATUSES);
            }
            return TransitionCheck.allow("");
        }

        requireKnown(before);
        requireKnown(after);
        SupplyDemandCase current = loadCase(caseId);
        requireCurrent(current, before);
        return validate(current, before, after);
    }

    // ------------------------------------------------------------------
    // Apply
    // ------------------------------------------------------------------

    /**
     * Move a case from before to after.
     *
     * Steps:
     *  1. Same level: nothing to do, whatever the case currently holds
     *  2. Re-read the case; a persisted status other than before is stale
     *  3. Validate against the case's full history
     *  4-5. Rewrite the history log (retotal / restart / rollback / chain) and record after
     *  6. Store after as the case's current status
     *  7. Close or reopen sibling cases when crossing the Awarded line
     *  8. Recompute the candidate's aggregate status
     *
     * @throws CaseServiceException CONFLICT when before is stale or the candidate would end up with
     *                              more than one active case at Awarded or later; VALIDATION when the
     *                              move is illegal
     */
    @Transactional
    public TransitionResult applyTransition(Long caseId, String before, String after) {
        requireKnown(before);
        requireKnown(after);

        // Step 1
        int beforeLevel = levelOf(before);
        int afterLevel  = levelOf(after);
        if (beforeLevel == afterLevel) {
            count("noop");
            return TransitionResult.noop();
        }

        // Step 2: optimistic concurrency guard
        SupplyDemandCase current = loadCase(caseId);
        requireCurrent(current, before);

        // Step 3
        TransitionCheck check = validate(current, before, after);
        if (!check.allowed()) {
            count("rejected");
            log.warn("Case {}: '{}' → '{}' rejected: {}", caseId, before, after, check.reason());
            throw new CaseServiceException(Kind.VALIDATION, check.reason(), check.suggestions());
        }

        // Steps 4-5
        long historyId = rewriteHistory(caseId, before, after);

        // Step 6
        current.setCurrentStatus(after);
        store.saveCase(current);

        // Steps 7-8
        List<String>   messages = new ArrayList<>();
        List<Long>     closed   = new ArrayList<>();
        if (beforeLevel >= AWARDED_LEVEL && afterLevel < AWARDED_LEVEL) {
            reopenSiblings(current, messages);
        }
        if (beforeLevel < AWARDED_LEVEL && afterLevel >= AWARDED_LEVEL) {
            closeSiblings(current, after, messages, closed);
        }
        if ((beforeLevel >= AWARDED_LEVEL) != (afterLevel >= AWARDED_LEVEL)) {
            requireExclusive(current);
        }
        refreshAggregateStatus(current, messages);

        count("applied");
        log.info("Case {}: '{}' → '{}' (history entry {}, closed cases {})",
                caseId, before, after, historyId, closed);
        return new TransitionResult(historyId, String.join("\n", messages), closed);
    }

    // ------------------------------------------------------------------
    // Batch invalidation
    // ------------------------------------------------------------------

    /**
     * Close every case in caseIds, provided all of them are listed under
     * ownerId in ownerTable. One foreign id rejects the whole batch.
     */
    @Transactional
    public void invalidateBatch(Collection<Long> caseIds, Long ownerId, String ownerTable) {
        CaseOwner owner = CaseOwner.fromTable(ownerTable)
                .orElseThrow(() -> CaseServiceException.input("Unsupported owner table: '" + ownerTable + "'"));
        if (caseIds == null || caseIds.isEmpty()) {
            return;
        }

        Set<Long> ids = new LinkedHashSet<>(caseIds);
        List<SupplyDemandCase> owned = store.findCasesForOwner(ids, ownerId, owner);
        if (owned.size() != ids.size()) {
            log.warn("Batch invalidation rejected: {} of {} cases belong to {} {}",
                    owned.size(), ids.size(), owner.table(), ownerId);
            throw CaseServiceException.notFound(
                    "Some cases do not belong to " + owner.table() + " " + ownerId + "; nothing was changed");
        }

        for (SupplyDemandCase c : owned) {
            c.setActive(false);
            c.setToBeConfirmed(false);
            store.saveCase(c);
        }
        log.info("Invalidated {} cases of {} {}", owned.size(), owner.table(), ownerId);
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    @Transactional
    public void updateHistoryRemark(Long caseId, Long historyId, String text) {
        String remark = text == null ? "" : text;
        if (remark.codePointCount(0, remark.length()) > remarkMaxLength) {
            throw CaseServiceException.input("Remark must not exceed " + remarkMaxLength + " characters");
        }
        CaseHistoryEntry entry = store.findHistory(historyId)
                .orElseThrow(() -> CaseServiceException.notFound("History entry not found: " + historyId));
        if (!Objects.equals(entry.getCaseId(), caseId)) {
            throw CaseServiceException.notFound(
                    "History entry " + historyId + " does not belong to case " + caseId);
        }
        entry.setRemark(remark);
        store.saveHistory(entry);
    }

    /** History of a case in seq order. */
    @Transactional(readOnly = true)
    public List<CaseHistoryEntry> listHistory(Long caseId, boolean activeOnly) {
        loadCase(caseId);
        return store.listHistory(caseId, activeOnly);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TransitionCheck validate(SupplyDemandCase current, String before, String after) {
        List<String> history = new ArrayList<>();
        for (CaseHistoryEntry entry : store.listHistory(current.getId(), false)) {
            history.add(entry.getStatus());
        }
        if (current.getCurrentStatus() != null) {
            history.add(current.getCurrentStatus());
        }
        return validator.validate(before, after, history, () -> isAwardedElsewhere(current));
    }

    private boolean isAwardedElsewhere(SupplyDemandCase current) {
        return store.findCasesBySupply(current.getSupplyId(), true).stream()
                .filter(other -> !other.getId().equals(current.getId()))
                .anyMatch(other -> persistedLevel(other.getCurrentStatus()) >= AWARDED_LEVEL);
    }

    /**
     * Rewrite the active log for before → after and record after.
     * Returns the id of the entry holding after.
     */
    private long rewriteHistory(Long caseId, String before, String after) {
        List<CaseHistoryEntry> active = new ArrayList<>(store.listHistory(caseId, true));
        StatusMeta beforeMeta = metaOf(before);
        StatusMeta afterMeta  = metaOf(after);
        boolean rollback = levelOf(after) < levelOf(before);
        boolean restart  = afterMeta.stage() == Stage.PROPOSAL && levelOf(before) >= AWARDED_LEVEL;

        // Step 4: keep every round group on one total
        if (afterMeta.isRoundBased()) {
            int currentTotal = maxTotalRounds(active.stream().map(CaseHistoryEntry::getStatus).toList());
            boolean retotal = afterMeta.sameStageAndRound(beforeMeta)
                    && !afterMeta.totalRounds().equals(beforeMeta.totalRounds());
            if (afterMeta.totalRounds() != currentTotal || retotal) {
                rewriter.rewriteRoundTotal(active, afterMeta.totalRounds());
            }
        }

        // Step 5
        if (afterMeta.sameStageAndRound(beforeMeta)) {
            return rewriter.appendOrMerge(caseId, active, before, after);
        }

        if (restart) {
            log.info("Case {}: restarting at '{}' from '{}'", caseId, after, before);
            active = rewriter.restart(active, afterMeta.round(), afterMeta.totalRounds());
            return rewriter.appendOrMerge(caseId, active, before, after);
        }

        if (rollback) {
            active = rewriter.rollback(active, after);
        }

        if (afterMeta.isRoundBased() && !skipChainRewrite(active, afterMeta, rollback)) {
            rewriter.rewriteChainPrefix(active, afterMeta.round(), afterMeta.totalRounds(),
                    afterMeta.stage().order());
        }
        return rewriter.appendOrMerge(caseId, active, before, after);
    }

    // A rollback into a later round, or a first proposal for a new round, starts
    // no chain of its own: the last proposal belongs to an earlier round.
    private static boolean skipChainRewrite(List<CaseHistoryEntry> active, StatusMeta afterMeta, boolean rollback) {
        if (afterMeta.round() <= 1) {
            return false;
        }
        if (rollback) {
            return true;
        }
        if (afterMeta.stage() != Stage.PROPOSAL) {
            return false;
        }
        return active.stream()
                .map(e -> metaOf(e.getStatus()))
                .noneMatch(m -> m.stage() == Stage.PROPOSAL
                        && m.round().equals(afterMeta.round())
                        && m.totalRounds().equals(afterMeta.totalRounds()));
    }

    private void closeSiblings(SupplyDemandCase current, String after,
                               List<String> messages, List<Long> closed) {
        for (SupplyDemandCase other : store.findCasesBySupply(current.getSupplyId(), true)) {
            if (other.getId().equals(current.getId())) continue;
            other.setActive(false);
            other.setReason("Closed automatically because case " + current.getId()
                    + " moved to status '" + after + "'.");
            store.saveCase(other);
            closed.add(other.getId());
            messages.add("Closed case " + other.getId() + " (status: " + other.getCurrentStatus() + ")");
            log.info("Case {} closed: case {} reached '{}'", other.getId(), current.getId(), after);
        }
    }

    // At most one reopened case may hold Awarded or later; further ones stay closed.
    private void reopenSiblings(SupplyDemandCase current, List<String> messages) {
        boolean awardedActive = countAwardedActive(current.getSupplyId()) > 0;
        for (SupplyDemandCase other : store.findCasesBySupply(current.getSupplyId(), false)) {
            if (other.getId().equals(current.getId())) continue;
            int level = persistedLevel(other.getCurrentStatus());
            if (level <= INIT_LEVEL) continue;
            if (level >= AWARDED_LEVEL) {
                if (awardedActive) {
                    messages.add("Kept case " + other.getId() + " closed (status: " + other.getCurrentStatus()
                            + "): another case of the candidate is already at " + AWARDED + " or later");
                    log.info("Case {} left closed: candidate {} already has an active case at '{}' or later",
                            other.getId(), current.getSupplyId(), AWARDED);
                    continue;
                }
                awardedActive = true;
            }
            other.setActive(true);
            store.saveCase(other);
            messages.add("Reopened case " + other.getId() + " (status: " + other.getCurrentStatus() + ")");
            log.info("Case {} reopened: case {} left '{}'", other.getId(), current.getId(), AWARDED);
        }
    }

    private void refreshAggregateStatus(SupplyDemandCase current, List<String> messages) {
        Long supplyId = current.getSupplyId();
        if (supplyId == null) return;

        String highest = null;
        for (SupplyDemandCase c : store.findCasesBySupply(supplyId, true)) {
            if (persistedLevel(c.getCurrentStatus()) > persistedLevel(highest)) {
                highest = c.getCurrentStatus();
            }
        }
        if (highest == null) return;

        String stored = store.findAggregateStatus(supplyId).orElse(null);
        if (!highest.equals(stored) && store.updateAggregateStatus(supplyId, highest)) {
            messages.add("Candidate " + supplyId + " status set to '" + highest + "'");
        }
    }

    private void requireExclusive(SupplyDemandCase current) {
        long awarded = countAwardedActive(current.getSupplyId());
        if (awarded > 1) {
            count("conflict");
            log.warn("Case {}: candidate {} would have {} active cases at '{}' or later",
                    current.getId(), current.getSupplyId(), awarded, AWARDED);
            throw new CaseServiceException(Kind.CONFLICT,
                    "Candidate " + current.getSupplyId() + " already has an active case at "
                    + AWARDED + " or later; refresh and retry");
        }
    }

    private long countAwardedActive(Long supplyId) {
        return store.findCasesBySupply(supplyId, true).stream()
                .filter(c -> persistedLevel(c.getCurrentStatus()) >= AWARDED_LEVEL)
                .count();
    }

    private SupplyDemandCase loadCase(Long caseId) {
        return store.findCase(caseId)
                .orElseThrow(() -> CaseServiceException.notFound("Case not found: " + caseId));
    }

    private void requireCurrent(SupplyDemandCase current, String before) {
        String persisted = current.getCurrentStatus();
        if (persisted != null && !persisted.equals(before)) {
            count("stale");
            log.warn("Case {}: stale before-status '{}' (persisted '{}')", current.getId(), before, persisted);
            throw new CaseServiceException(Kind.CONFLICT,
                    "Case " + current.getId() + " is currently '" + persisted + "'; refresh and retry");
        }
    }

    private static void requireKnown(String status) {
        if (!isKnown(status)) {
            throw CaseServiceException.notFound("Unknown status: '" + status + "'");
        }
    }

    private void count(String outcome) {
        meterRegistry.counter("caseengine.transition.calls", "outcome", outcome).increment();
    }
}
