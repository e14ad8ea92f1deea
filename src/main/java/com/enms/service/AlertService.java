package com.enms.service;

import com.enms.exception.ResourceNotFoundException;
import com.enms.model.Alert;
import com.enms.model.AlertSource;
import com.enms.model.Severity;
import com.enms.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    private static final int MAX_MESSAGE_LENGTH = 500;

    private final AlertRepository alertRepository;

    @Transactional
    public Alert raise(AlertSource source, String machineId, UUID referenceId, Severity severity, String message) {
        String text = message != null && message.length() > MAX_MESSAGE_LENGTH
            ? message.substring(0, MAX_MESSAGE_LENGTH)
            : message;
        Alert alert = alertRepository.save(Alert.builder()
            .source(source)
            .machineId(machineId)
            .referenceId(referenceId)
            .severity(severity)
            .message(text)
            .createdAt(Instant.now())
            .acknowledged(false)
            .build());
        log.info("Raised {} {} alert {} for machine {}: {}", severity, source, alert.getId(), machineId, text);
        return alert;
    }

    /**
     * Unacknowledged alerts, newest first. Every filter is optional; the time
     * range is [from, to).
     */
    @Transactional(readOnly = true)
    public List<Alert> listActiveAlerts(Severity severity, String machineId, Instant from, Instant to) {
        List<Alert> open = machineId == null
            ? alertRepository.findByAcknowledgedFalseOrderByCreatedAtDesc()
            : alertRepository.findByAcknowledgedFalseAndMachineIdOrderByCreatedAtDesc(machineId);
        return open.stream()
            .filter(a -> severity == null || a.getSeverity() == severity)
            .filter(a -> from == null || !a.getCreatedAt().isBefore(from))
            .filter(a -> to == null || a.getCreatedAt().isBefore(to))
            .collect(Collectors.toList());
    }

    @Transactional
    public Alert acknowledge(UUID alertId) {
        Alert alert = alertRepository.findById(alertId)
            .orElseThrow(() -> new ResourceNotFoundException("Alert " + alertId + " not found"));
        if (!alert.isAcknowledged()) {
            alert.acknowledge(Instant.now());
            alert = alertRepository.save(alert);
            log.info("Acknowledged alert {}", alertId);
        }
        return alert;
    }
}
