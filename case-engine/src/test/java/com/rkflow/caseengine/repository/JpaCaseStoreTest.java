package com.rkflow.caseengine.repository;

import com.rkflow.caseengine.model.CaseHistoryEntry;
import com.rkflow.caseengine.model.CaseOwner;
import com.rkflow.caseengine.model.SupplyRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaCaseStore with the Spring Data repositories mocked.
 */
@ExtendWith(MockitoExtension.class)
class JpaCaseStoreTest {

    @Mock SupplyDemandCaseRepository caseRepo;
    @Mock CaseHistoryRepository      historyRepo;
    @Mock SupplyRecordRepository     supplyRepo;

    JpaCaseStore store;

    @BeforeEach
    void setUp() {
        store = new JpaCaseStore(caseRepo, historyRepo, supplyRepo);
    }

    @Test
    void insertHistory_takesNextSeqForCase() {
        when(historyRepo.maxSeq(42L)).thenReturn(6L);
        when(historyRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        CaseHistoryEntry entry = store.insertHistory(42L, "Proposal Sent", "");

        ArgumentCaptor<CaseHistoryEntry> captor = ArgumentCaptor.forClass(CaseHistoryEntry.class);
        verify(historyRepo).save(captor.capture());
        assertThat(captor.getValue().getSeq()).isEqualTo(7);
        assertThat(entry.getCaseId()).isEqualTo(42L);
        assertThat(entry.isActive()).isTrue();
    }

    @Test
    void listHistory_activeOnlyUsesActiveQuery() {
        store.listHistory(42L, true);
        store.listHistory(42L, false);

        verify(historyRepo).findByCaseIdAndActiveTrueOrderBySeqAsc(42L);
        verify(historyRepo).findByCaseIdOrderBySeqAsc(42L);
    }

    @Test
    void findCasesForOwner_queriesByOwnerColumn() {
        List<Long> ids = List.of(1L, 2L);

        store.findCasesForOwner(ids, 9L, CaseOwner.SUPPLY);
        store.findCasesForOwner(ids, 9L, CaseOwner.DEMAND);

        verify(caseRepo).findByIdInAndSupplyId(ids, 9L);
        verify(caseRepo).findByIdInAndDemandId(ids, 9L);
    }

    @Test
    void findCasesBySupply_nullSupply_returnsEmptyWithoutQuery() {
        assertThat(store.findCasesBySupply(null, true)).isEmpty();

        verifyNoInteractions(caseRepo);
    }

    @Test
    void updateAggregateStatus_writesExistingSupply() {
        SupplyRecord supply = new SupplyRecord(5L);
        when(supplyRepo.findById(5L)).thenReturn(Optional.of(supply));

        boolean written = store.updateAggregateStatus(5L, "Awarded");

        assertThat(written).isTrue();
        assertThat(supply.getCaseStatus()).isEqualTo("Awarded");
        verify(supplyRepo).save(supply);
    }

    @Test
    void updateAggregateStatus_missingSupply_isIgnored() {
        when(supplyRepo.findById(5L)).thenReturn(Optional.empty());

        assertThat(store.updateAggregateStatus(5L, "Awarded")).isFalse();
        verify(supplyRepo, never()).save(any());
    }
}
