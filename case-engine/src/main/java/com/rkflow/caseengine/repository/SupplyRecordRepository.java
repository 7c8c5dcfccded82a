package com.rkflow.caseengine.repository;

import com.rkflow.caseengine.model.SupplyRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SupplyRecordRepository extends JpaRepository<SupplyRecord, Long> {
}
