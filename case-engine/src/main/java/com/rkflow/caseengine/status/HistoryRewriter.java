package com.rkflow.caseengine.status;

import com.rkflow.caseengine.model.CaseHistoryEntry;
import com.rkflow.caseengine.repository.CaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;

import static com.rkflow.caseengine.status.StatusCatalog.*;

/**
 * Structural edits to a case's active history.
 *
 * Every operation takes the case's active entries in seq order, edits them in
 * place through {@link CaseStore#saveHistory} and never deletes a row:
 * deactivation is the only way an entry leaves the active log. Running an
 * operation twice with the same arguments changes nothing the second time.
 *
 * Round numbers are recomputed from the log itself: an entry belongs to the
 * round given by the number of proposal entries up to and including it.
 */
@Component
public class HistoryRewriter {

    private static final Logger log = LoggerFactory.getLogger(HistoryRewriter.class);

    private final CaseStore store;

    public HistoryRewriter(CaseStore store) {
        this.store = store;
    }

    // ------------------------------------------------------------------
    // Round renumbering
    // ------------------------------------------------------------------

    /**
     * Relabel every round-bearing active entry under targetTotal, keeping its
     * stage and its position in the round sequence. Entries before the first
     * proposal, and rounds that do not exist under targetTotal, are left alone.
     */
    public void rewriteRoundTotal(List<CaseHistoryEntry> active, int targetTotal) {
        int round = 0;
        for (CaseHistoryEntry entry : active) {
            StatusMeta meta = metaOf(entry.getStatus());
            if (meta.stage() == Stage.PROPOSAL) round++;
            if (!meta.isRoundBased() || round == 0) continue;
            relabel(entry, round, targetTotal, meta.stage());
        }
    }

    /**
     * Relabel the run of active entries starting at the most recent proposal
     * onto (targetRound, targetTotal), for every entry whose stage order is at
     * most maxStageOrder.
     */
    public void rewriteChainPrefix(List<CaseHistoryEntry> active,
                                   int targetRound, int targetTotal, int maxStageOrder) {
        int start = lastProposalIndex(active);
        if (start < 0) return;
        for (CaseHistoryEntry entry : active.subList(start, active.size())) {
            StatusMeta meta = metaOf(entry.getStatus());
            if (!meta.isRoundBased() || meta.stage().order() > maxStageOrder) continue;
            relabel(entry, targetRound, targetTotal, meta.stage());
        }
    }

    // ------------------------------------------------------------------
    // Restart / rollback
    // ------------------------------------------------------------------

    /**
     * Re-enter the proposal stage after an award.
     *
     * Rounds before targetRound are renumbered 1..N under targetTotal. Entries
     * of round targetRound and later are not relabelled: they are deactivated,
     * along with every post-interview entry (Negotiation, Awarded, ...), so the
     * new proposal is the only active entry of its round.
     *
     * @return the entries still active, in seq order
     */
    public List<CaseHistoryEntry> restart(List<CaseHistoryEntry> active, int targetRound, int targetTotal) {
        List<CaseHistoryEntry> kept = new ArrayList<>();
        int round = 0;
        for (CaseHistoryEntry entry : active) {
            StatusMeta meta = metaOf(entry.getStatus());
            if (meta.stage() == Stage.PROPOSAL) round++;

            if (meta.isRoundBased()) {
                if (round >= targetRound) {
                    deactivate(entry);
                    continue;
                }
                if (round > 0) {
                    relabel(entry, round, targetTotal, meta.stage());
                }
            } else if (persistedLevel(entry.getStatus()) > MAX_INTERVIEW_LEVEL) {
                deactivate(entry);
                continue;
            }
            kept.add(entry);
        }
        return kept;
    }

    /**
     * Deactivate every active entry whose group-normalized level is at or above
     * that of targetStatus, so a whole stage/round group is cut together.
     *
     * @return the entries still active, in seq order
     */
    public List<CaseHistoryEntry> rollback(List<CaseHistoryEntry> active, String targetStatus) {
        int cut = groupLevel(targetStatus);
        List<CaseHistoryEntry> kept = new ArrayList<>();
        for (CaseHistoryEntry entry : active) {
            if (groupLevel(entry.getStatus()) >= cut) {
                deactivate(entry);
            } else {
                kept.add(entry);
            }
        }
        return kept;
    }

    // ------------------------------------------------------------------
    // Recording the new status
    // ------------------------------------------------------------------

    /**
     * Record after on the log. When before and after share stage and round,
     * the last active entry of that stage/round is updated in place; otherwise
     * a new active entry with an empty remark is appended.
     *
     * @return id of the updated or inserted entry
     */
    public Long appendOrMerge(Long caseId, List<CaseHistoryEntry> active, String before, String after) {
        StatusMeta afterMeta = metaOf(after);
        if (afterMeta.sameStageAndRound(metaOf(before))) {
            ListIterator<CaseHistoryEntry> it = active.listIterator(active.size());
            while (it.hasPrevious()) {
                CaseHistoryEntry entry = it.previous();
                if (metaOf(entry.getStatus()).sameStageAndRound(afterMeta)) {
                    if (!after.equals(entry.getStatus())) {
                        entry.setStatus(after);
                        store.saveHistory(entry);
                    }
                    log.debug("Case {}: merged '{}' into history entry {}", caseId, after, entry.getId());
                    return entry.getId();
                }
            }
        }
        CaseHistoryEntry inserted = store.insertHistory(caseId, after, "");
        log.debug("Case {}: appended history entry {} '{}'", caseId, inserted.getId(), after);
        return inserted.getId();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void relabel(CaseHistoryEntry entry, int round, int total, Stage stage) {
        statusAt(round, total, stage)
                .filter(name -> !name.equals(entry.getStatus()))
                .ifPresent(name -> {
                    log.debug("History entry {}: '{}' → '{}'", entry.getId(), entry.getStatus(), name);
                    entry.setStatus(name);
                    store.saveHistory(entry);
                });
    }

    private void deactivate(CaseHistoryEntry entry) {
        entry.setActive(false);
        store.saveHistory(entry);
    }

    private static int lastProposalIndex(List<CaseHistoryEntry> active) {
        for (int i = active.size() - 1; i >= 0; i--) {
            if (metaOf(active.get(i).getStatus()).stage() == Stage.PROPOSAL) {
                return i;
            }
        }
        return -1;
    }
}
