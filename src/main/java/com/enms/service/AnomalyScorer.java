package com.enms.service;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.InvalidReadingException;
import com.enms.exception.NoActiveModelException;
import com.enms.model.AlertSource;
import com.enms.model.Anomaly;
import com.enms.model.BaselineModel;
import com.enms.model.Severity;
import com.enms.repository.AnomalyRepository;
import com.enms.source.Reading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Scores live readings against the machine's active baseline.
 *
 *   expected = model prediction from the reading's drivers
 *   residual = observed - expected
 *   z        = (residual - residualMean) / max(residualStd, epsilon)
 *
 * Every scored reading is persisted, whatever its severity. Only non-normal
 * results raise an alert. Scoring reads the active model and never changes it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyScorer {

    private final ModelActivationService activationService;
    private final SeverityClassifier severityClassifier;
    private final AnomalyRepository anomalyRepository;
    private final AlertService alertService;
    private final AbTestManager abTestManager;
    private final AnalyticsProperties properties;

    /**
     * @throws NoActiveModelException  the machine has no active model
     * @throws InvalidReadingException the reading lacks a model driver or has a non-finite consumption
     */
    @Transactional
    public Anomaly scoreReading(String machineId, Reading reading) {
        BaselineModel model = activationService.requireActive(machineId);
        if (reading == null || reading.timestamp() == null) {
            throw new InvalidReadingException("Reading for machine " + machineId + " has no timestamp");
        }
        if (!Double.isFinite(reading.consumption())) {
            throw new InvalidReadingException("Reading for machine " + machineId + " at " + reading.timestamp()
                + " has non-finite consumption " + reading.consumption());
        }

        double expected = model.predict(reading.driverValues());
        double observed = reading.consumption();
        double residual = observed - expected;

        double epsilon = properties.getScoring().getStdEpsilon();
        boolean degenerate = model.getResidualStd() < epsilon;
        double std = degenerate ? epsilon : model.getResidualStd();
        if (degenerate) {
            log.warn("Degenerate model {} for machine {}: residual std {} floored to {}",
                model.getId(), machineId, model.getResidualStd(), epsilon);
        }

        double z = (residual - model.getResidualMean()) / std;
        Severity severity = severityClassifier.classify(z);
        double confidence = severityClassifier.confidence(z);
        double deviationPercent = expected == 0.0 ? 0.0 : (observed - expected) / expected * 100.0;

        Anomaly anomaly = anomalyRepository.save(Anomaly.builder()
            .machineId(machineId)
            .modelId(model.getId())
            .detectedAt(reading.timestamp())
            .observedValue(observed)
            .expectedValue(expected)
            .residual(residual)
            .residualZScore(z)
            .severity(severity)
            .confidenceScore(confidence)
            .deviationPercent(deviationPercent)
            .degenerateModel(degenerate)
            .resolved(false)
            .createdAt(Instant.now())
            .build());

        if (severity != Severity.NORMAL) {
            alertService.raise(AlertSource.ANOMALY, machineId, anomaly.getId(), severity, String.format(
                "%s consumption on %s at %s: observed %.3f, expected %.3f (z=%.2f, %.1f%%)",
                severity, machineId, reading.timestamp(), observed, expected, z, deviationPercent));
        }
        log.debug("Scored machine={} at {}: residual={} z={} severity={}",
            machineId, reading.timestamp(), residual, z, severity);

        abTestManager.recordTrialSample(machineId, model.getId(), residual, reading);
        return anomaly;
    }
}
