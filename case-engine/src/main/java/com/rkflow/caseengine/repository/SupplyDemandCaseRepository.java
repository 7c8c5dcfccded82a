package com.rkflow.caseengine.repository;

import com.rkflow.caseengine.model.SupplyDemandCase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

/**
 * CRUD + owner queries for the rk_supply_demand_link table.
 */
public interface SupplyDemandCaseRepository extends JpaRepository<SupplyDemandCase, Long> {

    List<SupplyDemandCase> findBySupplyIdAndActiveOrderByIdAsc(Long supplyId, boolean active);

    List<SupplyDemandCase> findByIdInAndSupplyId(Collection<Long> ids, Long supplyId);

    List<SupplyDemandCase> findByIdInAndDemandId(Collection<Long> ids, Long demandId);
}
