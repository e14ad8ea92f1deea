package com.enms.controller;

import com.enms.model.Alert;
import com.enms.model.Anomaly;
import com.enms.model.Severity;
import com.enms.service.AlertService;
import com.enms.service.AnomalyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operator surface for alerts and scored readings.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertService alertService;
    private final AnomalyService anomalyService;

    /**
     * GET /alerts?severity=CRITICAL&machineId=M-001&from=2026-01-15T00:00:00Z&to=2026-01-16T00:00:00Z
     *
     * All params optional; from is inclusive, to exclusive.
     */
    @GetMapping("/alerts")
    public ResponseEntity<List<Alert>> listActiveAlerts(
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) String machineId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(alertService.listActiveAlerts(severity, machineId, from, to));
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    public ResponseEntity<Alert> acknowledge(@PathVariable UUID alertId) {
        return ResponseEntity.ok(alertService.acknowledge(alertId));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<List<Anomaly>> listAnomalies(
            @RequestParam(required = false) String machineId,
            @RequestParam(required = false) Severity severity,
            @RequestParam(defaultValue = "false") boolean unresolvedOnly) {
        return ResponseEntity.ok(anomalyService.listAnomalies(machineId, severity, unresolvedOnly));
    }

    @PostMapping("/anomalies/{anomalyId}/resolve")
    public ResponseEntity<Anomaly> resolve(@PathVariable UUID anomalyId) {
        return ResponseEntity.ok(anomalyService.resolve(anomalyId));
    }
}
