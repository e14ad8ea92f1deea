package com.enms.source;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * One bucket as delivered by a {@link TimeSeriesSource}: consumption plus the
 * driver values measured in the same bucket.
 */
public record Reading(Instant timestamp, Map<String, Double> driverValues, double consumption) {

    public Reading {
        driverValues = driverValues == null ? Map.of() : withoutNulls(driverValues);
    }

    // a null value counts as a missing driver
    private static Map<String, Double> withoutNulls(Map<String, Double> values) {
        Map<String, Double> present = new HashMap<>();
        values.forEach((driver, value) -> {
            if (driver != null && value != null) {
                present.put(driver, value);
            }
        });
        return Map.copyOf(present);
    }

    /**
     * True when every named driver and the consumption are finite numbers.
     */
    public boolean isComplete(Collection<String> drivers) {
        if (!Double.isFinite(consumption)) {
            return false;
        }
        for (String driver : drivers) {
            Double value = driverValues.get(driver);
            if (value == null || !Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
