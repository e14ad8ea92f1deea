package com.enms.scheduler;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.AnalyticsException;
import com.enms.exception.ErrorCode;
import com.enms.model.AbTest;
import com.enms.model.JobType;
import com.enms.service.AbTestManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides every running A/B test whose trial window has ended. A trial short
 * of samples is extended by the manager and reported as skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AbEvaluationJob implements ScheduledJob {

    private final AbTestManager abTestManager;
    private final AnalyticsProperties properties;

    @Override
    public JobType type() {
        return JobType.AB_EVALUATION;
    }

    @Override
    public Duration interval() {
        return properties.getScheduler().getAbEvaluationInterval();
    }

    @Override
    public BatchReport run() {
        Instant now = Instant.now();
        BatchReport report = new BatchReport(type(), now);
        for (AbTest test : abTestManager.findDueTests(now)) {
            String machineId = test.getMachineId();
            try {
                abTestManager.decide(test.getId());
                report.recordSuccess(machineId);
            } catch (AnalyticsException e) {
                log.warn("A/B test {} for machine {} not decided: {} {}",
                    test.getId(), machineId, e.getCode(), e.getMessage());
                report.recordSkip(machineId, e.getCode().name());
            } catch (RuntimeException e) {
                log.error("A/B evaluation failed for test {}", test.getId(), e);
                report.recordSkip(machineId, ErrorCode.INTERNAL_ERROR.name());
            }
        }
        return report;
    }
}
