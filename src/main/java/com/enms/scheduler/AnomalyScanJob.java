package com.enms.scheduler;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.AnalyticsException;
import com.enms.exception.ErrorCode;
import com.enms.model.JobType;
import com.enms.model.Machine;
import com.enms.repository.AnomalyRepository;
import com.enms.service.AnomalyScorer;
import com.enms.service.MachineService;
import com.enms.source.Reading;
import com.enms.source.TimeSeriesSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Scores the latest reading of every active machine. Machines are scored in
 * parallel on the scoring pool; a reading that was already scored is skipped.
 */
@Component
@Slf4j
public class AnomalyScanJob implements ScheduledJob {

    static final String DUPLICATE = "DUPLICATE";

    private final MachineService machineService;
    private final TimeSeriesSource timeSeriesSource;
    private final AnomalyScorer anomalyScorer;
    private final AnomalyRepository anomalyRepository;
    private final AnalyticsProperties properties;
    private final Executor scoringExecutor;

    public AnomalyScanJob(MachineService machineService,
                          TimeSeriesSource timeSeriesSource,
                          AnomalyScorer anomalyScorer,
                          AnomalyRepository anomalyRepository,
                          AnalyticsProperties properties,
                          @Qualifier("scoringExecutor") Executor scoringExecutor) {
        this.machineService = machineService;
        this.timeSeriesSource = timeSeriesSource;
        this.anomalyScorer = anomalyScorer;
        this.anomalyRepository = anomalyRepository;
        this.properties = properties;
        this.scoringExecutor = scoringExecutor;
    }

    @Override
    public JobType type() {
        return JobType.ANOMALY_SCAN;
    }

    @Override
    public Duration interval() {
        return properties.getScheduler().getAnomalyInterval();
    }

    @Override
    public BatchReport run() {
        BatchReport report = new BatchReport(type(), Instant.now());
        List<Machine> machines = machineService.listActiveMachines();
        List<CompletableFuture<Outcome>> futures = machines.stream()
            .map(machine -> CompletableFuture.supplyAsync(() -> scan(machine.getId()), scoringExecutor))
            .collect(Collectors.toList());

        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            if (outcome.skipReason() == null) {
                report.recordSuccess(outcome.machineId());
            } else {
                report.recordSkip(outcome.machineId(), outcome.skipReason());
            }
        }
        return report;
    }

    private Outcome scan(String machineId) {
        try {
            Reading latest = timeSeriesSource.readLatest(machineId);
            if (anomalyRepository.existsByMachineIdAndDetectedAt(machineId, latest.timestamp())) {
                return new Outcome(machineId, DUPLICATE);
            }
            anomalyScorer.scoreReading(machineId, latest);
            return new Outcome(machineId, null);
        } catch (AnalyticsException e) {
            log.warn("Anomaly scan skipped machine {}: {} {}", machineId, e.getCode(), e.getMessage());
            return new Outcome(machineId, e.getCode().name());
        } catch (RuntimeException e) {
            log.error("Anomaly scan failed for machine {}", machineId, e);
            return new Outcome(machineId, ErrorCode.INTERNAL_ERROR.name());
        }
    }

    private record Outcome(String machineId, String skipReason) {
    }
}
