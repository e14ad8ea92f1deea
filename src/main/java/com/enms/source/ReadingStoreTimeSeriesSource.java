package com.enms.source;

import com.enms.exception.NoDataException;
import com.enms.exception.TransientSourceException;
import com.enms.model.EnergyReading;
import com.enms.repository.EnergyReadingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.TransientDataAccessException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link TimeSeriesSource} over the service's own reading store.
 * Transient database failures are rethrown as {@link TransientSourceException}
 * so the retry decorator can back off and try again.
 */
@RequiredArgsConstructor
public class ReadingStoreTimeSeriesSource implements TimeSeriesSource {

    private final EnergyReadingRepository readingRepository;

    @Override
    public List<Reading> readWindow(String machineId, List<String> driverNames, Instant start, Instant end) {
        try {
            return readingRepository.findWindow(machineId, start, end).stream()
                .map(r -> toReading(r, driverNames))
                .collect(Collectors.toList());
        } catch (TransientDataAccessException e) {
            throw new TransientSourceException("Reading window for " + machineId + " unavailable", e);
        }
    }

    @Override
    public Reading readLatest(String machineId) {
        try {
            return readingRepository.findFirstByMachineIdOrderByTimestampDesc(machineId)
                .map(r -> toReading(r, null))
                .orElseThrow(() -> new NoDataException("No readings for machine " + machineId));
        } catch (TransientDataAccessException e) {
            throw new TransientSourceException("Latest reading for " + machineId + " unavailable", e);
        }
    }

    private Reading toReading(EnergyReading reading, List<String> driverNames) {
        Map<String, Double> values;
        if (driverNames == null) {
            values = new HashMap<>(reading.getDriverValues());
        } else {
            values = new HashMap<>();
            for (String driver : driverNames) {
                Double value = reading.getDriverValues().get(driver);
                if (value != null) {
                    values.put(driver, value);
                }
            }
        }
        return new Reading(reading.getTimestamp(), values, reading.getConsumption());
    }
}
