package com.enms.scheduler;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.AnalyticsException;
import com.enms.exception.ErrorCode;
import com.enms.model.BaselineModel;
import com.enms.model.JobType;
import com.enms.model.Machine;
import com.enms.model.RetrainTrigger;
import com.enms.service.MachineService;
import com.enms.service.ModelActivationService;
import com.enms.service.RetrainCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Enqueues retraining for machines whose active model is older than the
 * configured maximum age, and for machines that have no model yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledRetrainJob implements ScheduledJob {

    static final String UP_TO_DATE = "UP_TO_DATE";

    private final MachineService machineService;
    private final ModelActivationService activationService;
    private final RetrainCoordinator retrainCoordinator;
    private final AnalyticsProperties properties;

    @Override
    public JobType type() {
        return JobType.SCHEDULED_RETRAIN;
    }

    @Override
    public Duration interval() {
        return properties.getScheduler().getRetrainInterval();
    }

    @Override
    public BatchReport run() {
        Instant now = Instant.now();
        BatchReport report = new BatchReport(type(), now);
        Instant cutoff = now.minus(properties.getScheduler().getModelMaxAge());

        for (Machine machine : machineService.listActiveMachines()) {
            String machineId = machine.getId();
            try {
                Optional<BaselineModel> active = activationService.resolveActive(machineId);
                if (active.isPresent() && active.get().getCreatedAt().isAfter(cutoff)) {
                    report.recordSkip(machineId, UP_TO_DATE);
                    continue;
                }
                retrainCoordinator.triggerRetrain(machineId, RetrainTrigger.SCHEDULED, null);
                report.recordSuccess(machineId);
            } catch (AnalyticsException e) {
                log.warn("Scheduled retrain skipped machine {}: {} {}", machineId, e.getCode(), e.getMessage());
                report.recordSkip(machineId, e.getCode().name());
            } catch (RuntimeException e) {
                log.error("Scheduled retrain failed for machine {}", machineId, e);
                report.recordSkip(machineId, ErrorCode.INTERNAL_ERROR.name());
            }
        }
        return report;
    }
}
