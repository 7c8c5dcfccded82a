package com.rkflow.caseengine.repository;

import com.rkflow.caseengine.model.CaseHistoryEntry;
import com.rkflow.caseengine.model.CaseOwner;
import com.rkflow.caseengine.model.SupplyDemandCase;
import com.rkflow.caseengine.model.SupplyRecord;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link CaseStore} backed by Spring Data JPA.
 *
 * Participates in the surrounding @Transactional method of CaseService, so
 * every write here is committed or rolled back together with the transition.
 */
@Component
public class JpaCaseStore implements CaseStore {

    private final SupplyDemandCaseRepository caseRepo;
    private final CaseHistoryRepository      historyRepo;
    private final SupplyRecordRepository     supplyRepo;

    public JpaCaseStore(SupplyDemandCaseRepository caseRepo,
                        CaseHistoryRepository historyRepo,
                        SupplyRecordRepository supplyRepo) {
        this.caseRepo    = caseRepo;
        this.historyRepo = historyRepo;
        this.supplyRepo  = supplyRepo;
    }

    // ------------------------------------------------------------------
    // Cases
    // ------------------------------------------------------------------

    @Override
    public Optional<SupplyDemandCase> findCase(Long caseId) {
        return caseRepo.findById(caseId);
    }

    @Override
    public SupplyDemandCase saveCase(SupplyDemandCase supplyDemandCase) {
        return caseRepo.save(supplyDemandCase);
    }

    @Override
    public List<SupplyDemandCase> findCasesBySupply(Long supplyId, boolean active) {
        if (supplyId == null) return List.of();
        return caseRepo.findBySupplyIdAndActiveOrderByIdAsc(supplyId, active);
    }

    @Override
    public List<SupplyDemandCase> findCasesForOwner(Collection<Long> caseIds, Long ownerId, CaseOwner owner) {
        return switch (owner) {
            case SUPPLY -> caseRepo.findByIdInAndSupplyId(caseIds, ownerId);
            case DEMAND -> caseRepo.findByIdInAndDemandId(caseIds, ownerId);
        };
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    @Override
    public List<CaseHistoryEntry> listHistory(Long caseId, boolean activeOnly) {
        return activeOnly
                ? historyRepo.findByCaseIdAndActiveTrueOrderBySeqAsc(caseId)
                : historyRepo.findByCaseIdOrderBySeqAsc(caseId);
    }

    @Override
    public Optional<CaseHistoryEntry> findHistory(Long historyId) {
        return historyRepo.findById(historyId);
    }

    @Override
    public CaseHistoryEntry insertHistory(Long caseId, String status, String remark) {
        long seq = historyRepo.maxSeq(caseId) + 1;
        return historyRepo.save(new CaseHistoryEntry(caseId, seq, status, remark));
    }

    @Override
    public CaseHistoryEntry saveHistory(CaseHistoryEntry entry) {
        return historyRepo.save(entry);
    }

    // ------------------------------------------------------------------
    // Candidate aggregate
    // ------------------------------------------------------------------

    @Override
    public Optional<String> findAggregateStatus(Long supplyId) {
        return supplyRepo.findById(supplyId).map(SupplyRecord::getCaseStatus);
    }

    @Override
    public boolean updateAggregateStatus(Long supplyId, String status) {
        Optional<SupplyRecord> supply = supplyRepo.findById(supplyId);
        if (supply.isEmpty()) {
            return false;
        }
        supply.get().setCaseStatus(status);
        supplyRepo.save(supply.get());
        return true;
    }
}
