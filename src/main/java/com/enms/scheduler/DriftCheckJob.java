package com.enms.scheduler;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.AnalyticsException;
import com.enms.exception.ErrorCode;
import com.enms.model.JobType;
import com.enms.model.Machine;
import com.enms.service.DriftMonitor;
import com.enms.service.MachineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs one drift evaluation cycle per active machine. A machine without an
 * active model or without recent data is skipped and does not block the rest.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DriftCheckJob implements ScheduledJob {

    private final MachineService machineService;
    private final DriftMonitor driftMonitor;
    private final AnalyticsProperties properties;

    @Override
    public JobType type() {
        return JobType.DRIFT_CHECK;
    }

    @Override
    public Duration interval() {
        return properties.getScheduler().getDriftInterval();
    }

    @Override
    public BatchReport run() {
        BatchReport report = new BatchReport(type(), Instant.now());
        for (Machine machine : machineService.listActiveMachines()) {
            String machineId = machine.getId();
            try {
                driftMonitor.checkDrift(machineId);
                report.recordSuccess(machineId);
            } catch (AnalyticsException e) {
                log.warn("Drift check skipped machine {}: {} {}", machineId, e.getCode(), e.getMessage());
                report.recordSkip(machineId, e.getCode().name());
            } catch (RuntimeException e) {
                log.error("Drift check failed for machine {}", machineId, e);
                report.recordSkip(machineId, ErrorCode.INTERNAL_ERROR.name());
            }
        }
        return report;
    }
}
