package com.enms.service;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.AnalyticsException;
import com.enms.exception.ErrorCode;
import com.enms.exception.IllegalStateTransitionException;
import com.enms.exception.ResourceNotFoundException;
import com.enms.model.AlertSource;
import com.enms.model.BaselineModel;
import com.enms.model.ModelStatus;
import com.enms.model.RetrainJob;
import com.enms.model.RetrainJobState;
import com.enms.model.RetrainTrigger;
import com.enms.model.Severity;
import com.enms.repository.RetrainJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Enqueues and supervises retraining jobs.
 *
 * Job lifecycle: QUEUED -> RUNNING -> COMPLETED | FAILED
 *
 * - At most one QUEUED or RUNNING job per machine; a second trigger returns the outstanding job
 * - A job holds one of the global training slots from start to finish; excess jobs stay QUEUED
 * - The fit runs on a separate worker so a job stops waiting once the timeout expires.
 *   The budget starts when the fit starts, and a timed-out job gives its slot back even
 *   though the abandoned fit may keep its worker busy until it returns
 * - On success the new model is activated directly (first model) or handed to an A/B trial
 * - On failure the job records the error code and an operator alert is raised;
 *   the active model is left untouched
 */
@Service
@Slf4j
public class RetrainCoordinator {

    private static final EnumSet<RetrainJobState> OUTSTANDING = EnumSet.of(RetrainJobState.QUEUED, RetrainJobState.RUNNING);

    private final RetrainJobRepository jobRepository;
    private final BaselineTrainer trainer;
    private final ModelActivationService activationService;
    private final AbTestManager abTestManager;
    private final AlertService alertService;
    private final MachineLockRegistry machineLocks;
    private final AnalyticsProperties properties;
    private final Executor retrainExecutor;
    private final AsyncTaskExecutor trainingWorkerExecutor;
    private final Semaphore trainingSlots;

    public RetrainCoordinator(RetrainJobRepository jobRepository,
                              BaselineTrainer trainer,
                              ModelActivationService activationService,
                              AbTestManager abTestManager,
                              AlertService alertService,
                              MachineLockRegistry machineLocks,
                              AnalyticsProperties properties,
                              @Qualifier("retrainExecutor") Executor retrainExecutor,
                              @Qualifier("trainingWorkerExecutor") AsyncTaskExecutor trainingWorkerExecutor) {
        this.jobRepository = jobRepository;
        this.trainer = trainer;
        this.activationService = activationService;
        this.abTestManager = abTestManager;
        this.alertService = alertService;
        this.machineLocks = machineLocks;
        this.properties = properties;
        this.retrainExecutor = retrainExecutor;
        this.trainingWorkerExecutor = trainingWorkerExecutor;
        this.trainingSlots = new Semaphore(Math.max(1, properties.getTraining().getMaxConcurrent()), true);
    }

    /**
     * Enqueue a retrain for the machine. Idempotent: while a job is queued or
     * running, that job is returned and nothing new is enqueued.
     *
     * @param driverOverride drivers to train on instead of the active model's, may be null
     */
    public RetrainJob triggerRetrain(String machineId, RetrainTrigger trigger, List<String> driverOverride) {
        RetrainJob job = machineLocks.withLock(machineId, () -> {
            Optional<RetrainJob> outstanding = findOutstanding(machineId);
            if (outstanding.isPresent()) {
                log.info("Retrain for machine {} already outstanding as job {} ({}), {} trigger ignored",
                    machineId, outstanding.get().getId(), outstanding.get().getState(), trigger);
                return null;
            }
            UUID activeModelId = activationService.resolveActive(machineId).map(BaselineModel::getId).orElse(null);
            RetrainJob created = jobRepository.save(RetrainJob.builder()
                .machineId(machineId)
                .triggeringModelId(activeModelId)
                .triggerType(trigger)
                .state(RetrainJobState.QUEUED)
                .driverOverride(driverOverride == null ? new ArrayList<>() : new ArrayList<>(driverOverride))
                .createdAt(Instant.now())
                .build());
            log.info("Enqueued retrain job {} for machine {} (trigger={}, model={})",
                created.getId(), machineId, trigger, activeModelId);
            return created;
        });
        if (job == null) {
            return findOutstanding(machineId).orElseThrow(() ->
                new IllegalStateException("Outstanding retrain job for " + machineId + " vanished"));
        }
        dispatch(job.getId());
        return job;
    }

    /**
     * Cancel a job that has not started yet.
     *
     * @throws IllegalStateTransitionException once the job is running or finished
     */
    public RetrainJob cancel(UUID jobId) {
        RetrainJob snapshot = getJob(jobId);
        return machineLocks.withLock(snapshot.getMachineId(), () -> {
            RetrainJob job = getJob(jobId);
            if (job.getState() != RetrainJobState.QUEUED) {
                throw new IllegalStateTransitionException(
                    "Retrain job " + jobId + " is " + job.getState() + " and can no longer be cancelled");
            }
            job.markFailed(ErrorCode.CANCELLED, "Cancelled before start", Instant.now());
            RetrainJob saved = jobRepository.save(job);
            log.info("Cancelled retrain job {} for machine {}", jobId, job.getMachineId());
            return saved;
        });
    }

    public RetrainJob getJob(UUID jobId) {
        return jobRepository.findById(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("Retrain job " + jobId + " not found"));
    }

    public List<RetrainJob> listJobs(String machineId) {
        return jobRepository.findByMachineIdOrderByCreatedAtDesc(machineId);
    }

    /**
     * Execute a queued job. Runs on the retrain pool and waits for a training slot;
     * returns without training if the job was cancelled or already picked up.
     */
    public void runJob(UUID jobId) {
        RetrainJob job = getJob(jobId);
        if (job.getState() != RetrainJobState.QUEUED) {
            log.info("Retrain job {} is {}, not starting", jobId, job.getState());
            return;
        }
        try {
            trainingSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retrain job {} interrupted while waiting for a training slot, left QUEUED", jobId);
            return;
        }
        try {
            train(jobId, job.getMachineId());
        } finally {
            trainingSlots.release();
        }
    }

    private void train(UUID jobId, String machineId) {
        RetrainJob running = machineLocks.withLock(machineId, () -> {
            RetrainJob current = getJob(jobId);
            if (current.getState() != RetrainJobState.QUEUED) {
                log.info("Retrain job {} is {}, not starting", jobId, current.getState());
                return null;
            }
            current.markRunning(Instant.now());
            return jobRepository.save(current);
        });
        if (running == null) {
            return;
        }

        List<String> drivers = chooseDrivers(running);
        Instant end = Instant.now();
        Instant start = end.minus(properties.getTraining().getWindow());
        Duration timeout = properties.getTraining().getTimeout();
        log.info("Retrain job {} running for machine {}: window=[{}, {}), drivers={}",
            jobId, machineId, start, end, drivers);

        BaselineModel draft;
        CountDownLatch fitStarted = new CountDownLatch(1);
        Future<BaselineModel> fit;
        try {
            fit = trainingWorkerExecutor.submit(() -> {
                fitStarted.countDown();
                return trainer.fit(machineId, start, end, drivers);
            });
        } catch (TaskRejectedException e) {
            fail(jobId, ErrorCode.INTERNAL_ERROR, "No training worker available: " + e.getMessage());
            return;
        }
        try {
            fitStarted.await();
            draft = fit.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            fit.cancel(true);
            log.warn("Retrain job {} for machine {} timed out after {}; the fit is abandoned and its result discarded",
                jobId, machineId, timeout);
            fail(jobId, ErrorCode.TIMEOUT, "Training exceeded " + timeout);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fit.cancel(true);
            fail(jobId, ErrorCode.INTERNAL_ERROR, "Interrupted while waiting for training");
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnalyticsException) {
                fail(jobId, ((AnalyticsException) cause).getCode(), cause.getMessage());
            } else {
                log.error("Retrain job {} for machine {} failed unexpectedly", jobId, machineId, cause);
                fail(jobId, ErrorCode.INTERNAL_ERROR, String.valueOf(cause));
            }
            return;
        }

        BaselineModel trained = draft;
        try {
            machineLocks.withLock(machineId, () -> promote(jobId, trained));
        } catch (AnalyticsException e) {
            fail(jobId, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Retrain job {} for machine {} failed while storing the model", jobId, machineId, e);
            fail(jobId, ErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }

    /**
     * Fail jobs a previous process left RUNNING and re-dispatch queued ones.
     */
    public void recoverInterruptedJobs() {
        for (RetrainJob job : jobRepository.findByState(RetrainJobState.RUNNING)) {
            fail(job.getId(), ErrorCode.INTERNAL_ERROR, "Interrupted by restart");
        }
        for (RetrainJob job : jobRepository.findByState(RetrainJobState.QUEUED)) {
            log.info("Re-dispatching queued retrain job {} for machine {}", job.getId(), job.getMachineId());
            dispatch(job.getId());
        }
    }

    private void promote(UUID jobId, BaselineModel draft) {
        String machineId = draft.getMachineId();
        BaselineModel stored = trainer.store(draft, ModelStatus.TRAINING);
        if (activationService.resolveActive(machineId).isEmpty()) {
            activationService.activateFirst(stored);
        } else {
            abTestManager.openTrial(machineId, stored.getId(), true);
        }
        RetrainJob job = getJob(jobId);
        job.markCompleted(stored.getId(), Instant.now());
        jobRepository.save(job);
        log.info("Retrain job {} completed for machine {}: model {} (v{})",
            jobId, machineId, stored.getId(), stored.getVersion());
    }

    private List<String> chooseDrivers(RetrainJob job) {
        if (job.getDriverOverride() != null && !job.getDriverOverride().isEmpty()) {
            return job.getDriverOverride();
        }
        return activationService.resolveActive(job.getMachineId())
            .map(BaselineModel::getDrivers)
            .orElseGet(() -> properties.getTraining().getDefaultDrivers());
    }

    private void fail(UUID jobId, ErrorCode reason, String detail) {
        RetrainJob job = getJob(jobId);
        boolean failed = machineLocks.withLock(job.getMachineId(), () -> {
            RetrainJob current = getJob(jobId);
            if (current.getState().isTerminal()) {
                return false;
            }
            current.markFailed(reason, detail, Instant.now());
            jobRepository.save(current);
            return true;
        });
        if (!failed) {
            return;
        }
        log.warn("Retrain job {} for machine {} failed with {}: {}", jobId, job.getMachineId(), reason, detail);
        alertService.raise(AlertSource.DRIFT, job.getMachineId(), jobId, Severity.WARNING,
            "Retraining failed for " + job.getMachineId() + " (" + reason + "): " + detail);
    }

    private Optional<RetrainJob> findOutstanding(String machineId) {
        return jobRepository.findByMachineIdAndStateIn(machineId, OUTSTANDING).stream().findFirst();
    }

    private void dispatch(UUID jobId) {
        retrainExecutor.execute(() -> {
            try {
                runJob(jobId);
            } catch (RuntimeException e) {
                log.error("Retrain job {} crashed", jobId, e);
            }
        });
    }
}
