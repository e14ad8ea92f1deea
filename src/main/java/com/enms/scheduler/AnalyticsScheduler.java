package com.enms.scheduler;

import com.enms.config.AnalyticsProperties;
import com.enms.dto.JobStatusResponse;
import com.enms.exception.ResourceNotFoundException;
import com.enms.model.JobOutcome;
import com.enms.model.JobType;
import com.enms.model.SchedulerJobState;
import com.enms.repository.SchedulerJobStateRepository;
import com.enms.service.RetrainCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Periodic driver for the fleet jobs.
 *
 * - A single dispatch thread fires each job type at its interval and only hands
 *   the body to the worker pool; it never runs job code itself
 * - Each job type has its own guard: an invocation that finds the previous one
 *   still running is skipped, not queued
 * - Last start/finish/outcome per job type is persisted, and on start each job
 *   is delayed until its next due time so a restart does not fire everything at once
 *
 * Started and stopped by the application context; disabled with
 * analytics.scheduler.enabled=false.
 */
@Component
@Slf4j
public class AnalyticsScheduler implements SmartLifecycle {

    static final Duration OVERDUE_STAGGER = Duration.ofSeconds(15);

    private final AnalyticsProperties properties;
    private final SchedulerJobStateRepository stateRepository;
    private final RetrainCoordinator retrainCoordinator;
    private final Executor workerExecutor;
    private final Map<JobType, ScheduledJob> jobs = new EnumMap<>(JobType.class);
    private final Map<JobType, AtomicBoolean> runningGuards = new EnumMap<>(JobType.class);

    private ScheduledExecutorService dispatcher;
    private volatile boolean running;

    @Autowired
    public AnalyticsScheduler(AnalyticsProperties properties,
                              List<ScheduledJob> scheduledJobs,
                              SchedulerJobStateRepository stateRepository,
                              RetrainCoordinator retrainCoordinator,
                              @Qualifier("schedulerWorkerExecutor") Executor workerExecutor) {
        this.properties = properties;
        this.stateRepository = stateRepository;
        this.retrainCoordinator = retrainCoordinator;
        this.workerExecutor = workerExecutor;
        for (ScheduledJob job : scheduledJobs) {
            if (jobs.put(job.type(), job) != null) {
                throw new IllegalStateException("Duplicate scheduled job for " + job.type());
            }
            runningGuards.put(job.type(), new AtomicBoolean(false));
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        retrainCoordinator.recoverInterruptedJobs();

        dispatcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "analytics-dispatch");
            t.setDaemon(true);
            return t;
        });
        Instant now = Instant.now();
        for (ScheduledJob job : jobs.values()) {
            Duration delay = initialDelay(job, now);
            dispatcher.scheduleAtFixedRate(() -> dispatchSafely(job.type()),
                delay.toMillis(), job.interval().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Scheduled {} every {} (first run in {})", job.type(), job.interval(), delay);
        }
        running = true;
        log.info("Analytics scheduler started with {} job types", jobs.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        dispatcher.shutdownNow();
        running = false;
        log.info("Analytics scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getScheduler().isEnabled();
    }

    /**
     * Hand one invocation of the job type to the worker pool unless the
     * previous invocation is still running.
     */
    public DispatchResult dispatch(JobType type) {
        ScheduledJob job = jobs.get(type);
        if (job == null) {
            throw new ResourceNotFoundException("No scheduled job registered for " + type);
        }
        AtomicBoolean guard = runningGuards.get(type);
        if (!guard.compareAndSet(false, true)) {
            log.warn("Skipping {}: previous invocation still running", type);
            return DispatchResult.SKIPPED;
        }
        try {
            workerExecutor.execute(() -> execute(job, guard));
            return DispatchResult.SUBMITTED;
        } catch (RejectedExecutionException e) {
            guard.set(false);
            log.warn("Worker pool rejected {}: {}", type, e.getMessage());
            return DispatchResult.REJECTED;
        }
    }

    public DispatchResult triggerJob(JobType type) {
        log.info("Manual trigger of {}", type);
        return dispatch(type);
    }

    public List<JobStatusResponse> getStatus() {
        List<JobStatusResponse> status = new ArrayList<>();
        for (ScheduledJob job : jobs.values()) {
            Optional<SchedulerJobState> state = stateRepository.findById(job.type());
            status.add(JobStatusResponse.builder()
                .jobType(job.type())
                .interval(job.interval())
                .running(runningGuards.get(job.type()).get())
                .lastStartedAt(state.map(SchedulerJobState::getLastStartedAt).orElse(null))
                .lastFinishedAt(state.map(SchedulerJobState::getLastFinishedAt).orElse(null))
                .lastOutcome(state.map(SchedulerJobState::getLastOutcome).orElse(null))
                .lastMessage(state.map(SchedulerJobState::getLastMessage).orElse(null))
                .build());
        }
        return status;
    }

    /**
     * Delay before the first run after start:
     * - never ran: one full interval
     * - next run still ahead: the time left until it is due
     * - overdue: a short stagger by job order so overdue jobs do not fire together
     */
    Duration initialDelay(ScheduledJob job, Instant now) {
        Optional<Instant> lastStart = stateRepository.findById(job.type())
            .map(SchedulerJobState::getLastStartedAt);
        if (lastStart.isEmpty()) {
            return job.interval();
        }
        Instant due = lastStart.get().plus(job.interval());
        if (due.isAfter(now)) {
            return Duration.between(now, due);
        }
        return OVERDUE_STAGGER.multipliedBy(job.type().ordinal());
    }

    private void dispatchSafely(JobType type) {
        try {
            dispatch(type);
        } catch (RuntimeException e) {
            // an exception here would cancel the periodic task
            log.error("Dispatch of {} failed", type, e);
        }
    }

    private void execute(ScheduledJob job, AtomicBoolean guard) {
        JobType type = job.type();
        Instant startedAt = Instant.now();
        try {
            persist(type, state -> state.setLastStartedAt(startedAt));
            BatchReport report = job.run();
            String summary = report.summary();
            log.info("Job {} finished in {} ms: {}", type,
                Duration.between(startedAt, Instant.now()).toMillis(), summary);
            persist(type, state -> {
                state.setLastFinishedAt(Instant.now());
                state.setLastOutcome(JobOutcome.SUCCEEDED);
                state.setLastMessage(truncate(summary));
            });
        } catch (RuntimeException e) {
            log.error("Job {} failed", type, e);
            persist(type, state -> {
                state.setLastFinishedAt(Instant.now());
                state.setLastOutcome(JobOutcome.FAILED);
                state.setLastMessage(truncate(String.valueOf(e.getMessage())));
            });
        } finally {
            guard.set(false);
        }
    }

    private void persist(JobType type, Consumer<SchedulerJobState> update) {
        try {
            SchedulerJobState state = stateRepository.findById(type)
                .orElseGet(() -> SchedulerJobState.builder().jobType(type).build());
            update.accept(state);
            stateRepository.save(state);
        } catch (DataAccessException e) {
            log.error("Could not persist scheduler state for {}", type, e);
        }
    }

    private static String truncate(String message) {
        return message.length() > 1000 ? message.substring(0, 1000) : message;
    }
}
