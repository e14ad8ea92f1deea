package com.enms.repository;

import com.enms.model.Alert;
import com.enms.model.AlertSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AlertRepository extends JpaRepository<Alert, UUID> {

    List<Alert> findByAcknowledgedFalseOrderByCreatedAtDesc();

    List<Alert> findByAcknowledgedFalseAndMachineIdOrderByCreatedAtDesc(String machineId);

    List<Alert> findByMachineIdAndSource(String machineId, AlertSource source);
}
