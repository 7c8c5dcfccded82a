package com.rkflow.caseengine.repository;

import com.rkflow.caseengine.model.CaseHistoryEntry;
import com.rkflow.caseengine.model.CaseOwner;
import com.rkflow.caseengine.model.SupplyDemandCase;

import java.util.*;

/**
 * {@link CaseStore} over plain maps, for tests that exercise the engine
 * without a database.
 *
 * Entities are stored by reference, so edits made through the returned
 * objects are visible to later reads, as with a JPA persistence context.
 * Ids are assigned reflectively since JPA normally generates them.
 */
public class InMemoryCaseStore implements CaseStore {

    private final Map<Long, SupplyDemandCase> cases      = new LinkedHashMap<>();
    private final Map<Long, CaseHistoryEntry> history    = new LinkedHashMap<>();
    private final Map<Long, String>           aggregates = new HashMap<>();

    private long nextCaseId    = 100;
    private long nextHistoryId = 1;

    // ------------------------------------------------------------------
    // Seeding
    // ------------------------------------------------------------------

    /** Create a case whose history is the given trail; its current status is the last one. */
    public SupplyDemandCase seedCase(Long supplyId, Long demandId, String... trail) {
        String current = trail.length == 0 ? null : trail[trail.length - 1];
        SupplyDemandCase c = new SupplyDemandCase(supplyId, demandId, current);
        setId(c, nextCaseId++);
        cases.put(c.getId(), c);
        for (String status : trail) {
            insertHistory(c.getId(), status, "");
        }
        return c;
    }

    /** Create the candidate row; without it aggregate updates are ignored. */
    public void seedSupply(Long supplyId, String aggregateStatus) {
        aggregates.put(supplyId, aggregateStatus);
    }

    /** Active history statuses of a case, in seq order. */
    public List<String> activeStatuses(Long caseId) {
        return listHistory(caseId, true).stream().map(CaseHistoryEntry::getStatus).toList();
    }

    public int historySize(Long caseId) {
        return listHistory(caseId, false).size();
    }

    public List<SupplyDemandCase> allCases() {
        return new ArrayList<>(cases.values());
    }

    // ------------------------------------------------------------------
    // CaseStore
    // ------------------------------------------------------------------

    @Override
    public Optional<SupplyDemandCase> findCase(Long caseId) {
        return Optional.ofNullable(cases.get(caseId));
    }

    @Override
    public SupplyDemandCase saveCase(SupplyDemandCase supplyDemandCase) {
        if (supplyDemandCase.getId() == null) {
            setId(supplyDemandCase, nextCaseId++);
        }
        cases.put(supplyDemandCase.getId(), supplyDemandCase);
        return supplyDemandCase;
    }

    @Override
    public List<SupplyDemandCase> findCasesBySupply(Long supplyId, boolean active) {
        return cases.values().stream()
                .filter(c -> Objects.equals(c.getSupplyId(), supplyId) && c.isActive() == active)
                .sorted(Comparator.comparing(SupplyDemandCase::getId))
                .toList();
    }

    @Override
    public List<SupplyDemandCase> findCasesForOwner(Collection<Long> caseIds, Long ownerId, CaseOwner owner) {
        return cases.values().stream()
                .filter(c -> caseIds.contains(c.getId()))
                .filter(c -> Objects.equals(owner == CaseOwner.SUPPLY ? c.getSupplyId() : c.getDemandId(), ownerId))
                .toList();
    }

    @Override
    public List<CaseHistoryEntry> listHistory(Long caseId, boolean activeOnly) {
        return history.values().stream()
                .filter(e -> e.getCaseId().equals(caseId))
                .filter(e -> !activeOnly || e.isActive())
                .sorted(Comparator.comparingLong(CaseHistoryEntry::getSeq))
                .toList();
    }

    @Override
    public Optional<CaseHistoryEntry> findHistory(Long historyId) {
        return Optional.ofNullable(history.get(historyId));
    }

    @Override
    public CaseHistoryEntry insertHistory(Long caseId, String status, String remark) {
        long seq = history.values().stream()
                .filter(e -> e.getCaseId().equals(caseId))
                .mapToLong(CaseHistoryEntry::getSeq)
                .max()
                .orElse(0) + 1;
        CaseHistoryEntry entry = new CaseHistoryEntry(caseId, seq, status, remark);
        setId(entry, nextHistoryId++);
        history.put(entry.getId(), entry);
        return entry;
    }

    @Override
    public CaseHistoryEntry saveHistory(CaseHistoryEntry entry) {
        history.put(entry.getId(), entry);
        return entry;
    }

    @Override
    public Optional<String> findAggregateStatus(Long supplyId) {
        return Optional.ofNullable(aggregates.get(supplyId));
    }

    @Override
    public boolean updateAggregateStatus(Long supplyId, String status) {
        if (!aggregates.containsKey(supplyId)) {
            return false;
        }
        aggregates.put(supplyId, status);
        return true;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void setId(Object entity, Long id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
