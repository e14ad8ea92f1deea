package com.enms.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools.
 *
 * - retrainExecutor: runs retrain jobs; its size is the global training cap,
 *   excess jobs wait in its queue
 * - trainingWorkerExecutor: executes the fit itself so a job can stop waiting
 *   when the timeout expires. It never queues, and has room beyond the training cap
 *   for fits abandoned after a timeout that are still running
 * - schedulerWorkerExecutor: runs scheduler job bodies off the dispatch thread
 * - scoringExecutor: fans an anomaly scan out across machines
 */
@Configuration
public class ExecutorConfig {

    // worker threads per training slot, the extra ones absorb abandoned fits
    private static final int TRAINING_WORKER_HEADROOM = 4;

    @Bean(name = "retrainExecutor")
    public ThreadPoolTaskExecutor retrainExecutor(AnalyticsProperties properties) {
        int slots = Math.max(1, properties.getTraining().getMaxConcurrent());
        return pool("retrain-", slots);
    }

    @Bean(name = "trainingWorkerExecutor")
    public ThreadPoolTaskExecutor trainingWorkerExecutor(AnalyticsProperties properties) {
        int slots = Math.max(1, properties.getTraining().getMaxConcurrent());
        ThreadPoolTaskExecutor executor = pool("training-", slots);
        executor.setMaxPoolSize(slots * TRAINING_WORKER_HEADROOM);
        executor.setQueueCapacity(0);
        return executor;
    }

    @Bean(name = "schedulerWorkerExecutor")
    public ThreadPoolTaskExecutor schedulerWorkerExecutor(AnalyticsProperties properties) {
        return pool("job-", Math.max(1, properties.getScheduler().getWorkerThreads()));
    }

    @Bean(name = "scoringExecutor")
    public ThreadPoolTaskExecutor scoringExecutor(AnalyticsProperties properties) {
        return pool("scoring-", Math.max(1, properties.getScheduler().getScoringThreads()));
    }

    private ThreadPoolTaskExecutor pool(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
