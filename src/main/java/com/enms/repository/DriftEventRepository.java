package com.enms.repository;

import com.enms.model.DriftDecision;
import com.enms.model.DriftEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DriftEventRepository extends JpaRepository<DriftEvent, UUID> {

    Optional<DriftEvent> findFirstByModelIdAndDecisionOrderByDetectedAtDesc(UUID modelId, DriftDecision decision);

    List<DriftEvent> findByMachineIdOrderByDetectedAtDesc(String machineId);
}
