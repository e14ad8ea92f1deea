package com.enms.config;

import com.enms.repository.EnergyReadingRepository;
import com.enms.source.ReadingStoreTimeSeriesSource;
import com.enms.source.RetryingTimeSeriesSource;
import com.enms.source.TimeSeriesSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the time-series source: the reading store wrapped with retry/backoff.
 */
@Configuration
public class SourceConfig {

    @Bean
    public TimeSeriesSource timeSeriesSource(EnergyReadingRepository readingRepository,
                                             AnalyticsProperties properties) {
        return new RetryingTimeSeriesSource(
            new ReadingStoreTimeSeriesSource(readingRepository),
            properties.getSource().getRetry());
    }
}
