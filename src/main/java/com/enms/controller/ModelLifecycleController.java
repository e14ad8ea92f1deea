package com.enms.controller;

import com.enms.dto.PerformanceTrendResponse;
import com.enms.dto.RetrainRequest;
import com.enms.dto.ScoreReadingRequest;
import com.enms.dto.StartAbTestRequest;
import com.enms.dto.TrainBaselineRequest;
import com.enms.model.AbTest;
import com.enms.model.Anomaly;
import com.enms.model.BaselineModel;
import com.enms.model.DriftEvent;
import com.enms.model.RetrainJob;
import com.enms.model.RetrainTrigger;
import com.enms.service.AbTestManager;
import com.enms.service.AnomalyScorer;
import com.enms.service.BaselineTrainer;
import com.enms.service.DriftMonitor;
import com.enms.service.ModelActivationService;
import com.enms.service.RetrainCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Model lifecycle operations.
 *
 * Endpoints:
 * 1. POST /machines/{id}/baselines - Train a baseline over a window
 * 2. GET /baselines/{modelId}, GET /machines/{id}/baselines - Inspect models
 * 3. POST /machines/{id}/readings/score - Score one reading against the active model
 * 4. POST /machines/{id}/drift-check - Run one drift cycle (204 when no drift)
 * 5. GET /machines/{id}/performance-trend - R² direction of the active model
 * 6. POST /machines/{id}/retrain, GET/POST /retrain-jobs/... - Retraining
 * 7. POST /machines/{id}/ab-tests, GET/POST /ab-tests/... - A/B trials
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ModelLifecycleController {

    private final BaselineTrainer trainer;
    private final ModelActivationService activationService;
    private final AnomalyScorer anomalyScorer;
    private final DriftMonitor driftMonitor;
    private final RetrainCoordinator retrainCoordinator;
    private final AbTestManager abTestManager;

    @PostMapping("/machines/{machineId}/baselines")
    public ResponseEntity<BaselineModel> trainBaseline(@PathVariable String machineId,
                                                       @Valid @RequestBody TrainBaselineRequest request) {
        log.info("Training baseline for machine={}, window=[{}, {}), drivers={}",
                 machineId, request.getStart(), request.getEnd(), request.getDrivers());
        BaselineModel model = trainer.trainBaseline(machineId, request.getStart(), request.getEnd(), request.getDrivers());
        if (request.isActivateIfFirst() && activationService.resolveActive(machineId).isEmpty()) {
            model = activationService.activateFirst(model);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(model);
    }

    @GetMapping("/baselines/{modelId}")
    public ResponseEntity<BaselineModel> getModel(@PathVariable UUID modelId) {
        return ResponseEntity.ok(activationService.getModel(modelId));
    }

    @GetMapping("/machines/{machineId}/baselines")
    public ResponseEntity<List<BaselineModel>> listModels(@PathVariable String machineId) {
        return ResponseEntity.ok(activationService.listModels(machineId));
    }

    @PostMapping("/machines/{machineId}/readings/score")
    public ResponseEntity<Anomaly> scoreReading(@PathVariable String machineId,
                                                @Valid @RequestBody ScoreReadingRequest request) {
        return ResponseEntity.ok(anomalyScorer.scoreReading(machineId, request.toReading()));
    }

    @PostMapping("/machines/{machineId}/drift-check")
    public ResponseEntity<DriftEvent> checkDrift(@PathVariable String machineId) {
        return driftMonitor.checkDrift(machineId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/machines/{machineId}/drift-events")
    public ResponseEntity<List<DriftEvent>> listDriftEvents(@PathVariable String machineId) {
        return ResponseEntity.ok(driftMonitor.listDriftEvents(machineId));
    }

    @GetMapping("/machines/{machineId}/performance-trend")
    public ResponseEntity<PerformanceTrendResponse> performanceTrend(@PathVariable String machineId,
                                                                     @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(driftMonitor.performanceTrend(machineId, limit));
    }

    /**
     * Idempotent: returns the outstanding job when one is already queued or running.
     */
    @PostMapping("/machines/{machineId}/retrain")
    public ResponseEntity<RetrainJob> triggerRetrain(@PathVariable String machineId,
                                                     @RequestBody(required = false) RetrainRequest request) {
        List<String> drivers = request == null ? null : request.getDrivers();
        RetrainJob job = retrainCoordinator.triggerRetrain(machineId, RetrainTrigger.MANUAL, drivers);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping("/machines/{machineId}/retrain-jobs")
    public ResponseEntity<List<RetrainJob>> listRetrainJobs(@PathVariable String machineId) {
        return ResponseEntity.ok(retrainCoordinator.listJobs(machineId));
    }

    @GetMapping("/retrain-jobs/{jobId}")
    public ResponseEntity<RetrainJob> getRetrainJob(@PathVariable UUID jobId) {
        return ResponseEntity.ok(retrainCoordinator.getJob(jobId));
    }

    @PostMapping("/retrain-jobs/{jobId}/cancel")
    public ResponseEntity<RetrainJob> cancelRetrainJob(@PathVariable UUID jobId) {
        return ResponseEntity.ok(retrainCoordinator.cancel(jobId));
    }

    @PostMapping("/machines/{machineId}/ab-tests")
    public ResponseEntity<AbTest> startAbTest(@PathVariable String machineId,
                                              @Valid @RequestBody StartAbTestRequest request) {
        AbTest test = abTestManager.startAbTest(machineId, request.getChallengerModelId());
        return ResponseEntity.status(HttpStatus.CREATED).body(test);
    }

    @GetMapping("/ab-tests/{testId}")
    public ResponseEntity<AbTest> getAbTest(@PathVariable UUID testId) {
        return ResponseEntity.ok(abTestManager.getAbTest(testId));
    }

    /**
     * Decide now instead of waiting for the trial window to end.
     */
    @PostMapping("/ab-tests/{testId}/decide")
    public ResponseEntity<AbTest> decideAbTest(@PathVariable UUID testId) {
        return ResponseEntity.ok(abTestManager.decide(testId));
    }
}
