package com.enms.support;

import com.enms.model.EnergyReading;
import com.enms.source.Reading;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthetic readings over the default driver set.
 */
public final class TestReadings {

    public static final String PRODUCTION = "production_count";
    public static final String TEMPERATURE = "outdoor_temp_c";
    public static final String PRESSURE = "pressure_bar";
    public static final List<String> DRIVERS = List.of(PRODUCTION, TEMPERATURE, PRESSURE);

    private TestReadings() {
    }

    public static Map<String, Double> drivers(double production, double temperature, double pressure) {
        Map<String, Double> values = new HashMap<>();
        values.put(PRODUCTION, production);
        values.put(TEMPERATURE, temperature);
        values.put(PRESSURE, pressure);
        return values;
    }

    /**
     * Driver values for bucket i. The three series are not linearly related.
     */
    public static Map<String, Double> driversAt(int i) {
        return drivers(10 + i, (i * 7) % 13, 2 + Math.sin(i));
    }

    /**
     * consumption = 5 + 2 * production + 3 * temperature - pressure, exactly.
     */
    public static double linearConsumption(Map<String, Double> drivers) {
        return 5 + 2 * drivers.get(PRODUCTION) + 3 * drivers.get(TEMPERATURE) - drivers.get(PRESSURE);
    }

    public static List<EnergyReading> linearSeries(String machineId, Instant start, int count, Duration step) {
        List<EnergyReading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Double> drivers = driversAt(i);
            readings.add(reading(machineId, start.plus(step.multipliedBy(i)), linearConsumption(drivers), drivers));
        }
        return readings;
    }

    /**
     * Same series as {@link #linearSeries}, as delivered by a time-series source.
     */
    public static List<Reading> linearReadings(Instant start, int count, Duration step) {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Double> drivers = driversAt(i);
            readings.add(new Reading(start.plus(step.multipliedBy(i)), drivers, linearConsumption(drivers)));
        }
        return readings;
    }

    public static EnergyReading reading(String machineId, Instant timestamp, double consumption, Map<String, Double> drivers) {
        return EnergyReading.builder()
            .machineId(machineId)
            .timestamp(timestamp)
            .receivedTime(Instant.now())
            .consumption(consumption)
            .driverValues(new HashMap<>(drivers))
            .payloadHash("test-" + timestamp)
            .build();
    }
}
