package com.enms.service;

import com.enms.exception.ResourceNotFoundException;
import com.enms.model.Anomaly;
import com.enms.model.Severity;
import com.enms.repository.AnomalyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operator-facing access to scored readings. Resolution is the only change an
 * anomaly ever sees after creation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyService {

    private final AnomalyRepository anomalyRepository;

    @Transactional(readOnly = true)
    public List<Anomaly> listAnomalies(String machineId, Severity severity, boolean unresolvedOnly) {
        return anomalyRepository.search(machineId, severity, unresolvedOnly);
    }

    @Transactional
    public Anomaly resolve(UUID anomalyId) {
        Anomaly anomaly = anomalyRepository.findById(anomalyId)
            .orElseThrow(() -> new ResourceNotFoundException("Anomaly " + anomalyId + " not found"));
        if (!anomaly.isResolved()) {
            anomaly.resolve(Instant.now());
            anomaly = anomalyRepository.save(anomaly);
            log.info("Resolved anomaly {} on machine {}", anomalyId, anomaly.getMachineId());
        }
        return anomaly;
    }
}
