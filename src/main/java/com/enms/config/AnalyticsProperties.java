package com.enms.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for training, scoring, drift, A/B trials, scheduling and the
 * time-series source. Read from application.properties under "analytics".
 *
 * Severity thresholds, degradation ratio and consecutive-cycle count are
 * operational defaults; every deployment is expected to review them.
 */
@Component
@ConfigurationProperties(prefix = "analytics")
@Data
public class AnalyticsProperties {

    private Training training = new Training();
    private Scoring scoring = new Scoring();
    private Drift drift = new Drift();
    private AbTest abTest = new AbTest();
    private Scheduler scheduler = new Scheduler();
    private Source source = new Source();

    @Data
    public static class Training {
        /** Minimum number of drivers a baseline must be fitted on. */
        private int minDrivers = 3;
        /** Minimum complete buckets left after dropping rows with missing drivers. */
        private int minSamples = 20;
        /** Models below this R² are kept but logged as low quality. */
        private double minRSquared = 0.5;
        /** Trailing window used by retraining jobs. */
        private Duration window = Duration.ofDays(30);
        /** Global cap on concurrent training runs. */
        private int maxConcurrent = 2;
        /** Wall-clock budget for one training run. */
        private Duration timeout = Duration.ofMinutes(5);
        /** Drivers used for a machine that has never had a model. */
        private List<String> defaultDrivers = new ArrayList<>(
            List.of("production_count", "outdoor_temp_c", "pressure_bar"));
    }

    @Data
    public static class Scoring {
        private double warningZ = 2.0;
        private double criticalZ = 3.0;
        /** k in confidence = 1 - exp(-|z| / k). */
        private double confidenceScale = 2.0;
        /** Floor applied to the residual standard deviation. */
        private double stdEpsilon = 1e-9;
    }

    @Data
    public static class Drift {
        private Duration evaluationWindow = Duration.ofHours(24);
        /** Drift when evaluation RMSE exceeds training RMSE by more than this factor. */
        private double degradationRatio = 1.5;
        private int minConsecutiveCycles = 2;
        private int minSamples = 5;
        /** Floor applied to the training RMSE when forming the ratio. */
        private double errorEpsilon = 1e-9;
    }

    @Data
    public static class AbTest {
        private Duration trialWindow = Duration.ofHours(24);
        /** Both arms need at least this many samples before a decision. */
        private int minSamples = 20;
        /** MAE differences at or below this keep the incumbent. */
        private double tieEpsilon = 0.01;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private Duration anomalyInterval = Duration.ofMinutes(5);
        private Duration driftInterval = Duration.ofHours(1);
        private Duration retrainInterval = Duration.ofHours(24);
        private Duration abEvaluationInterval = Duration.ofMinutes(15);
        private int workerThreads = 4;
        private int scoringThreads = 4;
        /** Scheduled retraining picks up active models older than this. */
        private Duration modelMaxAge = Duration.ofDays(7);
    }

    @Data
    public static class Source {
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int maxAttempts = 3;
            private Duration initialBackoff = Duration.ofMillis(200);
            private double multiplier = 2.0;
            private Duration maxBackoff = Duration.ofSeconds(2);
        }
    }
}
