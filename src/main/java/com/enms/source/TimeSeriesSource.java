package com.enms.source;

import java.time.Instant;
import java.util.List;

/**
 * Historical and live readings per machine. The analytics core only consumes
 * this interface; where the data actually lives is the implementation's concern.
 */
public interface TimeSeriesSource {

    /**
     * Readings with {@code start <= timestamp < end}, oldest first. Driver maps
     * are restricted to the requested names; a driver not measured in a bucket
     * is simply absent.
     */
    List<Reading> readWindow(String machineId, List<String> driverNames, Instant start, Instant end);

    /**
     * Newest reading for the machine, with all recorded drivers.
     *
     * @throws com.enms.exception.NoDataException if the machine has no readings
     */
    Reading readLatest(String machineId);
}
