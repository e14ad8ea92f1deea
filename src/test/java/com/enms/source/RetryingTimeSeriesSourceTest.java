package com.enms.source;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.NoDataException;
import com.enms.exception.TransientSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RetryingTimeSeriesSourceTest {

    private TimeSeriesSource delegate;
    private RetryingTimeSeriesSource source;

    @BeforeEach
    void setUp() {
        delegate = mock(TimeSeriesSource.class);
        AnalyticsProperties.Source.Retry retry = new AnalyticsProperties.Source.Retry();
        retry.setMaxAttempts(3);
        retry.setInitialBackoff(Duration.ofMillis(1));
        retry.setMaxBackoff(Duration.ofMillis(2));
        source = new RetryingTimeSeriesSource(delegate, retry);
    }

    @Test
    void testTransientFailuresRetried() {
        Reading reading = new Reading(Instant.now(), Map.of("a", 1.0), 10.0);
        when(delegate.readWindow(anyString(), anyList(), any(), any()))
            .thenThrow(new TransientSourceException("down"))
            .thenThrow(new TransientSourceException("still down"))
            .thenReturn(List.of(reading));

        List<Reading> result = source.readWindow("M-1", List.of("a"), Instant.EPOCH, Instant.now());

        assertEquals(List.of(reading), result);
        verify(delegate, times(3)).readWindow(anyString(), anyList(), any(), any());
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        when(delegate.readLatest("M-1")).thenThrow(new TransientSourceException("down"));

        assertThrows(TransientSourceException.class, () -> source.readLatest("M-1"));
        verify(delegate, times(3)).readLatest("M-1");
    }

    @Test
    void testNoDataNotRetried() {
        when(delegate.readLatest("M-1")).thenThrow(new NoDataException("empty"));

        assertThrows(NoDataException.class, () -> source.readLatest("M-1"));
        verify(delegate, times(1)).readLatest("M-1");
    }
}
