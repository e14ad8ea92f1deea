package com.enms.service;

import com.enms.config.AnalyticsProperties;
import com.enms.dto.PerformanceTrendResponse;
import com.enms.exception.InsufficientDataException;
import com.enms.exception.NoActiveModelException;
import com.enms.model.AlertSource;
import com.enms.model.BaselineModel;
import com.enms.model.DriftDecision;
import com.enms.model.DriftEvent;
import com.enms.model.MetricKind;
import com.enms.model.PerformanceMetric;
import com.enms.model.RetrainJob;
import com.enms.model.RetrainTrigger;
import com.enms.model.Severity;
import com.enms.model.TrendDirection;
import com.enms.repository.DriftEventRepository;
import com.enms.repository.PerformanceMetricRepository;
import com.enms.source.Reading;
import com.enms.source.TimeSeriesSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tracks live predictive performance of each active model.
 *
 * One evaluation cycle:
 * 1. Score the trailing evaluation window with the active model and append an EVALUATION metric
 * 2. ratio = window RMSE / training RMSE
 * 3. ratio at or below the degradation ratio: no drift, nothing else recorded
 * 4. Breach: count breaching cycles in a row for this model, current one included,
 *    starting after the model's last RETRAIN_TRIGGERED event
 *    - below the required count: drift event with decision IGNORED
 *    - at or above: drift event with decision RETRAIN_TRIGGERED, alert, retrain enqueued
 *
 * The whole cycle holds the machine lock so a retrain cannot start mid-evaluation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriftMonitor {

    private static final double TREND_SLOPE_THRESHOLD = 0.001;

    private final TimeSeriesSource timeSeriesSource;
    private final ModelActivationService activationService;
    private final PerformanceMetricRepository metricRepository;
    private final DriftEventRepository driftEventRepository;
    private final RetrainCoordinator retrainCoordinator;
    private final AlertService alertService;
    private final MachineLockRegistry machineLocks;
    private final AnalyticsProperties properties;

    /**
     * Run one evaluation cycle for the machine's active model.
     *
     * @return the drift event, or empty when the window is within the degradation ratio
     * @throws NoActiveModelException    the machine has no active model
     * @throws InsufficientDataException the evaluation window has too few complete readings
     */
    public Optional<DriftEvent> checkDrift(String machineId) {
        return machineLocks.withLock(machineId, () -> evaluate(machineId));
    }

    /**
     * R² direction across the active model's most recent evaluations.
     */
    public PerformanceTrendResponse performanceTrend(String machineId, int limit) {
        BaselineModel model = activationService.requireActive(machineId);
        List<PerformanceMetric> recent = new ArrayList<>(
            metricRepository.findRecent(model.getId(), MetricKind.EVALUATION, PageRequest.of(0, Math.max(1, limit))));
        Collections.reverse(recent);

        SimpleRegression regression = new SimpleRegression();
        int index = 0;
        for (PerformanceMetric metric : recent) {
            if (metric.getRSquared() != null) {
                regression.addData(index, metric.getRSquared());
            }
            index++;
        }

        double slope = regression.getN() < 2 ? 0.0 : regression.getSlope();
        if (!Double.isFinite(slope)) {
            slope = 0.0;
        }
        TrendDirection direction;
        if (slope < -TREND_SLOPE_THRESHOLD) {
            direction = TrendDirection.DEGRADING;
        } else if (slope > TREND_SLOPE_THRESHOLD) {
            direction = TrendDirection.IMPROVING;
        } else {
            direction = TrendDirection.STABLE;
        }

        return PerformanceTrendResponse.builder()
            .machineId(machineId)
            .modelId(model.getId())
            .direction(direction)
            .slope(slope)
            .points(recent.stream()
                .map(m -> PerformanceTrendResponse.Point.builder()
                    .recordedAt(m.getRecordedAt())
                    .sampleCount(m.getSampleCount())
                    .meanAbsoluteError(m.getMeanAbsoluteError())
                    .rootMeanSquaredError(m.getRootMeanSquaredError())
                    .rSquared(m.getRSquared())
                    .build())
                .collect(Collectors.toList()))
            .build();
    }

    public List<DriftEvent> listDriftEvents(String machineId) {
        return driftEventRepository.findByMachineIdOrderByDetectedAtDesc(machineId);
    }

    private Optional<DriftEvent> evaluate(String machineId) {
        BaselineModel model = activationService.requireActive(machineId);
        AnalyticsProperties.Drift config = properties.getDrift();

        Instant end = Instant.now();
        Instant start = end.minus(config.getEvaluationWindow());
        List<String> drivers = model.getDrivers();
        List<Reading> complete = timeSeriesSource.readWindow(machineId, drivers, start, end).stream()
            .filter(r -> r.isComplete(drivers))
            .collect(Collectors.toList());
        if (complete.size() < config.getMinSamples()) {
            throw new InsufficientDataException(String.format(
                "Drift check for %s needs %d complete readings in the last %s, found %d",
                machineId, config.getMinSamples(), config.getEvaluationWindow(), complete.size()));
        }

        double[] actual = new double[complete.size()];
        double[] predicted = new double[complete.size()];
        for (int i = 0; i < complete.size(); i++) {
            actual[i] = complete.get(i).consumption();
            predicted[i] = model.predict(complete.get(i).driverValues());
        }
        RegressionMetrics window = RegressionMetrics.of(actual, predicted);

        metricRepository.save(PerformanceMetric.builder()
            .modelId(model.getId())
            .machineId(machineId)
            .kind(MetricKind.EVALUATION)
            .windowStart(start)
            .windowEnd(end)
            .sampleCount(window.sampleCount())
            .meanAbsoluteError(window.meanAbsoluteError())
            .rootMeanSquaredError(window.rootMeanSquaredError())
            .rSquared(window.rSquared())
            .recordedAt(end)
            .build());

        double baselineError = Math.max(model.getTrainingRmse(), config.getErrorEpsilon());
        double ratio = window.rootMeanSquaredError() / baselineError;
        if (ratio <= config.getDegradationRatio()) {
            log.info("No drift for machine {} model {}: RMSE {} vs training {} (ratio {})",
                machineId, model.getId(), window.rootMeanSquaredError(), model.getTrainingRmse(), ratio);
            return Optional.empty();
        }

        int required = Math.max(1, config.getMinConsecutiveCycles());
        // a streak that already triggered a retrain does not count toward the next one
        Instant lastTrigger = driftEventRepository
            .findFirstByModelIdAndDecisionOrderByDetectedAtDesc(model.getId(), DriftDecision.RETRAIN_TRIGGERED)
            .map(DriftEvent::getDetectedAt)
            .orElse(null);
        int consecutive = 0;
        for (PerformanceMetric metric : metricRepository.findRecent(model.getId(), MetricKind.EVALUATION, PageRequest.of(0, required))) {
            if (lastTrigger != null && !metric.getRecordedAt().isAfter(lastTrigger)) {
                break;
            }
            if (metric.getRootMeanSquaredError() / baselineError > config.getDegradationRatio()) {
                consecutive++;
            } else {
                break;
            }
        }
        DriftDecision decision = consecutive >= required ? DriftDecision.RETRAIN_TRIGGERED : DriftDecision.IGNORED;

        DriftEvent event = driftEventRepository.save(DriftEvent.builder()
            .modelId(model.getId())
            .machineId(machineId)
            .detectedAt(end)
            .degradationRatio(ratio)
            .triggeringMetric(DriftEvent.METRIC_RMSE)
            .evaluationError(window.rootMeanSquaredError())
            .baselineError(model.getTrainingRmse())
            .consecutiveBreaches(consecutive)
            .decision(decision)
            .build());

        if (decision == DriftDecision.IGNORED) {
            log.info("Drift breach for machine {} model {} ignored: ratio {} on {} of {} required cycles",
                machineId, model.getId(), ratio, consecutive, required);
            return Optional.of(event);
        }

        log.info("Drift declared for machine {} model {}: ratio {} for {} consecutive cycles",
            machineId, model.getId(), ratio, consecutive);
        alertService.raise(AlertSource.DRIFT, machineId, event.getId(), Severity.WARNING, String.format(
            "Model v%d for %s degraded: RMSE %.3f is %.2fx the training RMSE for %d cycles, retraining",
            model.getVersion(), machineId, window.rootMeanSquaredError(), ratio, consecutive));
        RetrainJob job = retrainCoordinator.triggerRetrain(machineId, RetrainTrigger.DRIFT, null);
        log.info("Drift event {} handed to retrain job {} ({})", event.getId(), job.getId(), job.getState());
        return Optional.of(event);
    }
}
