package com.enms.service;

import com.enms.exception.ErrorCode;
import com.enms.exception.IllegalStateTransitionException;
import com.enms.model.AbTest;
import com.enms.model.AbTestStatus;
import com.enms.model.AlertSource;
import com.enms.model.BaselineModel;
import com.enms.model.ModelStatus;
import com.enms.model.RetrainJob;
import com.enms.model.RetrainJobState;
import com.enms.model.RetrainTrigger;
import com.enms.repository.AbTestRepository;
import com.enms.repository.AlertRepository;
import com.enms.repository.EnergyReadingRepository;
import com.enms.repository.RetrainJobRepository;
import com.enms.support.DatabaseCleaner;
import com.enms.support.TestModels;
import com.enms.support.TestReadings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for RetrainCoordinator. The retrain pool is replaced by a mock so
 * each test decides when a queued job runs.
 *
 * Tests cover:
 * 1. A second trigger returns the outstanding job
 * 2. Cancelling a queued job; running or finished jobs cannot be cancelled
 * 3. Failed training records the reason, raises an alert, keeps the active model
 * 4. First successful training activates the model directly
 * 5. Training with an active model opens an A/B trial
 * 6. A cancelled job never starts
 * 7. Driver override with too few drivers
 * 8. Restart recovery of running and queued jobs
 */
@SpringBootTest
@ActiveProfiles("test")
class RetrainCoordinatorTest {

    private static final String MACHINE = "HVAC-3";

    @MockBean(name = "retrainExecutor")
    private Executor retrainExecutor;

    @Autowired
    private RetrainCoordinator coordinator;

    @Autowired
    private BaselineTrainer trainer;

    @Autowired
    private ModelActivationService activationService;

    @Autowired
    private RetrainJobRepository jobRepository;

    @Autowired
    private AbTestRepository abTestRepository;

    @Autowired
    private AlertRepository alertRepository;

    @Autowired
    private EnergyReadingRepository readingRepository;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
    }

    /**
     * Test 1: Two triggers while queued → one job, one dispatch
     */
    @Test
    void testTriggerIsIdempotentWhileOutstanding() {
        RetrainJob first = coordinator.triggerRetrain(MACHINE, RetrainTrigger.MANUAL, null);
        RetrainJob second = coordinator.triggerRetrain(MACHINE, RetrainTrigger.DRIFT, null);

        assertEquals(first.getId(), second.getId());
        assertEquals(RetrainJobState.QUEUED, second.getState());
        assertEquals(1, jobRepository.count());
        verify(retrainExecutor, times(1)).execute(any());
    }

    /**
     * Test 2: Queued job cancels to FAILED/CANCELLED; cancelling again is an illegal transition
     */
    @Test
    void testCancelQueuedJob() {
        RetrainJob job = coordinator.triggerRetrain(MACHINE, RetrainTrigger.MANUAL, null);

        RetrainJob cancelled = coordinator.cancel(job.getId());

        assertEquals(RetrainJobState.FAILED, cancelled.getState());
        assertEquals(ErrorCode.CANCELLED, cancelled.getFailureReason());
        assertThrows(IllegalStateTransitionException.class, () -> coordinator.cancel(job.getId()));

        RetrainJob next = coordinator.triggerRetrain(MACHINE, RetrainTrigger.MANUAL, null);
        assertNotEquals(job.getId(), next.getId());
    }

    /**
     * Test 3: No readings → FAILED/INSUFFICIENT_DATA, alert raised, active model unchanged
     */
    @Test
    void testFailureKeepsActiveModel() {
        BaselineModel active = activationService.activateFirst(
            trainer.store(TestModels.constant(MACHINE, 100.0, 1.0, 1.0), ModelStatus.TRAINING));
        RetrainJob job = coordinator.triggerRetrain(MACHINE, RetrainTrigger.MANUAL, null);

        coordinator.runJob(job.getId());

        RetrainJob failed = coordinator.getJob(job.getId());
        assertEquals(RetrainJobState.FAILED, failed.getState());
        assertEquals(ErrorCode.INSUFFICIENT_DATA, failed.getFailureReason());
        assertEquals(active.getId(), failed.getTriggeringModelId());
        assertEquals(1, alertRepository.findByMachineIdAndSource(MACHINE, AlertSource.DRIFT).size());
        assertEquals(active.getId(), activationService.requireActive(MACHINE).getId());
        assertEquals(1, activationService.listModels(MACHINE).size());
        assertThrows(IllegalStateTransitionException.class, () -> coordinator.cancel(job.getId()));
    }

    /**
     * Test 4: Machine without a model → trained on default drivers and activated directly
     */
    @Test
    void testFirstModelActivatedDirectly() {
        seedReadings();
        RetrainJob job = coordinator.triggerRetrain(MACHINE, RetrainTrigger.SCHEDULED, null);

        coordinator.runJob(job.getId());

        RetrainJob completed = coordinator.getJob(job.getId());
        assertEquals(RetrainJobState.COMPLETED, completed.getState());
        BaselineModel active = activationService.requireActive(MACHINE);
        assertEquals(completed.getResultModelId(), active.getId());
        assertEquals(ModelStatus.ACTIVE, active.getStatus());
        assertEquals(2.0, active.getCoefficients().get(TestReadings.PRODUCTION), 1e-6);
        assertEquals(0, abTestRepository.count());
    }

    /**
     * Test 5: Machine with an active model → new model becomes challenger in a running trial
     */
    @Test
    void testRetrainOpensTrial() {
        seedReadings();
        BaselineModel incumbent = activationService.activateFirst(
            trainer.store(TestModels.constant(MACHINE, 100.0, 1.0, 1.0), ModelStatus.TRAINING));
        RetrainJob job = coordinator.triggerRetrain(MACHINE, RetrainTrigger.DRIFT, null);

        coordinator.runJob(job.getId());

        RetrainJob completed = coordinator.getJob(job.getId());
        assertEquals(RetrainJobState.COMPLETED, completed.getState());
        assertEquals(incumbent.getId(), activationService.requireActive(MACHINE).getId());
        assertEquals(ModelStatus.CHALLENGER, activationService.getModel(completed.getResultModelId()).getStatus());
        assertEquals(2, activationService.getModel(completed.getResultModelId()).getVersion());

        AbTest trial = abTestRepository.findFirstByMachineIdAndStatus(MACHINE, AbTestStatus.RUNNING).orElseThrow();
        assertEquals(incumbent.getId(), trial.getIncumbentModelId());
        assertEquals(completed.getResultModelId(), trial.getChallengerModelId());
    }

    /**
     * Test 6: A job cancelled before the pool picks it up is not run
     */
    @Test
    void testCancelledJobNeverStarts() {
        seedReadings();
        RetrainJob job = coordinator.triggerRetrain(MACHINE, RetrainTrigger.MANUAL, null);
        coordinator.cancel(job.getId());

        coordinator.runJob(job.getId());

        RetrainJob after = coordinator.getJob(job.getId());
        assertEquals(RetrainJobState.FAILED, after.getState());
        assertNull(after.getStartedAt());
        assertTrue(activationService.resolveActive(MACHINE).isEmpty());
    }

    /**
     * Test 7: Override naming two drivers → FAILED/INSUFFICIENT_DRIVERS
     */
    @Test
    void testDriverOverrideTooSmall() {
        seedReadings();
        RetrainJob job = coordinator.triggerRetrain(MACHINE, RetrainTrigger.MANUAL,
            List.of(TestReadings.PRODUCTION, TestReadings.TEMPERATURE));

        coordinator.runJob(job.getId());

        assertEquals(ErrorCode.INSUFFICIENT_DRIVERS, coordinator.getJob(job.getId()).getFailureReason());
    }

    /**
     * Test 8: RUNNING jobs left by a previous process fail, QUEUED jobs are dispatched again
     */
    @Test
    void testRecoverInterruptedJobs() {
        RetrainJob stale = jobRepository.save(RetrainJob.builder()
            .machineId("OTHER-1")
            .triggerType(RetrainTrigger.SCHEDULED)
            .state(RetrainJobState.QUEUED)
            .createdAt(Instant.now())
            .build());
        stale.markRunning(Instant.now());
        jobRepository.save(stale);
        coordinator.triggerRetrain(MACHINE, RetrainTrigger.MANUAL, null);

        coordinator.recoverInterruptedJobs();

        RetrainJob recovered = coordinator.getJob(stale.getId());
        assertEquals(RetrainJobState.FAILED, recovered.getState());
        assertEquals(ErrorCode.INTERNAL_ERROR, recovered.getFailureReason());
        // once at trigger, once at recovery
        verify(retrainExecutor, times(2)).execute(any());
    }

    private void seedReadings() {
        Instant start = Instant.now().minus(5, ChronoUnit.DAYS).truncatedTo(ChronoUnit.HOURS);
        readingRepository.saveAll(TestReadings.linearSeries(MACHINE, start, 40, Duration.ofHours(1)));
    }
}
