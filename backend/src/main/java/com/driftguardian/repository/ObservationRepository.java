package com.driftguardian.repository;

import com.driftguardian.entity.ObservationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ObservationRepository extends JpaRepository<ObservationRecord, Long> {

    List<ObservationRecord> findByModelIdOrderByIdAsc(String modelId);

    long countByModelId(String modelId);

    long deleteByModelId(String modelId);
}
