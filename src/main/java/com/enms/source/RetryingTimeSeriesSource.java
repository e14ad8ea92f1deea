package com.enms.source;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.TransientSourceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorator adding bounded exponential backoff to a {@link TimeSeriesSource}.
 * Only {@link TransientSourceException} is retried; NoData and every other
 * failure propagate on the first attempt.
 */
@Slf4j
public class RetryingTimeSeriesSource implements TimeSeriesSource {

    private final TimeSeriesSource delegate;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    public RetryingTimeSeriesSource(TimeSeriesSource delegate, AnalyticsProperties.Source.Retry retry) {
        this.delegate = delegate;
        this.maxAttempts = Math.max(1, retry.getMaxAttempts());
        this.initialBackoff = retry.getInitialBackoff();
        this.multiplier = retry.getMultiplier();
        this.maxBackoff = retry.getMaxBackoff();
    }

    @Override
    public List<Reading> readWindow(String machineId, List<String> driverNames, Instant start, Instant end) {
        return withRetry("readWindow(" + machineId + ")",
            () -> delegate.readWindow(machineId, driverNames, start, end));
    }

    @Override
    public Reading readLatest(String machineId) {
        return withRetry("readLatest(" + machineId + ")", () -> delegate.readLatest(machineId));
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        long backoffMs = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientSourceException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.debug("{} attempt {} failed, retrying in {} ms", operation, attempt, backoffMs);
                sleep(backoffMs, operation, e);
                backoffMs = Math.min((long) (backoffMs * multiplier), maxBackoff.toMillis());
            }
        }
    }

    private void sleep(long millis, String operation, TransientSourceException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientSourceException(operation + " interrupted during backoff", cause);
        }
    }
}
