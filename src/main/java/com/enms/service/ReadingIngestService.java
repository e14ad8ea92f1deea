package com.enms.service;

import com.enms.dto.BatchIngestResponse;
import com.enms.dto.ReadingDTO;
import com.enms.model.EnergyReading;
import com.enms.repository.EnergyReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Stores readings delivered by meter gateways. This is the data behind the
 * default time-series source.
 *
 * Thread Safety Strategy:
 * - One transaction per batch
 * - Unique (machineId, timestamp) constraint in the database
 * - Optimistic locking on the reading row for concurrent corrections
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReadingIngestService {

    private final EnergyReadingRepository readingRepository;

    private static final long MAX_FUTURE_MINUTES = 15;

    /**
     * Process a batch of readings with validation, deduplication and updates.
     *
     * Algorithm:
     * 1. Validate each reading (consumption, timestamp, driver values)
     * 2. Collapse repeats of the same (machine, timestamp) within the batch, last one wins
     * 3. Look up stored buckets per machine
     * 4. For each reading:
     *    - If new: add to save list
     *    - If stored with same payload: dedupe
     *    - If stored with different payload: update in place
     * 5. Save all changes in one transaction
     */
    @Transactional
    public BatchIngestResponse ingestBatch(List<ReadingDTO> readings) {
        if (readings == null || readings.isEmpty()) {
            return BatchIngestResponse.builder().build();
        }

        Instant now = Instant.now();
        List<BatchIngestResponse.RejectionDetail> rejections = new ArrayList<>();
        Map<String, Map<Instant, ReadingDTO>> validByMachine = new LinkedHashMap<>();
        int deduped = 0;

        for (ReadingDTO reading : readings) {
            String validationError = validateReading(reading, now);
            if (validationError != null) {
                rejections.add(BatchIngestResponse.RejectionDetail.builder()
                    .machineId(reading == null ? null : reading.getMachineId())
                    .timestamp(reading == null ? null : reading.getTimestamp())
                    .reason(validationError)
                    .build());
                continue;
            }
            ReadingDTO previous = validByMachine
                .computeIfAbsent(reading.getMachineId(), id -> new LinkedHashMap<>())
                .put(reading.getTimestamp(), reading);
            if (previous != null) {
                deduped++;
            }
        }

        List<EnergyReading> toSave = new ArrayList<>();
        int accepted = 0, updated = 0;

        for (Map.Entry<String, Map<Instant, ReadingDTO>> machineEntry : validByMachine.entrySet()) {
            String machineId = machineEntry.getKey();
            Map<Instant, ReadingDTO> byTimestamp = machineEntry.getValue();
            Map<Instant, EnergyReading> existing = readingRepository
                .findByMachineIdAndTimestampIn(machineId, byTimestamp.keySet()).stream()
                .collect(Collectors.toMap(EnergyReading::getTimestamp, r -> r));

            for (ReadingDTO dto : byTimestamp.values()) {
                Map<String, Double> drivers = cleanDrivers(dto.getDrivers());
                String newHash = calculatePayloadHash(dto.getConsumption(), drivers);
                EnergyReading stored = existing.get(dto.getTimestamp());

                if (stored == null) {
                    toSave.add(EnergyReading.builder()
                        .machineId(machineId)
                        .timestamp(dto.getTimestamp())
                        .receivedTime(now)
                        .consumption(dto.getConsumption())
                        .driverValues(new HashMap<>(drivers))
                        .payloadHash(newHash)
                        .build());
                    accepted++;
                } else if (stored.getPayloadHash().equals(newHash)) {
                    deduped++;
                } else {
                    stored.setConsumption(dto.getConsumption());
                    stored.getDriverValues().clear();
                    stored.getDriverValues().putAll(drivers);
                    stored.setPayloadHash(newHash);
                    stored.setReceivedTime(now);
                    toSave.add(stored);
                    updated++;
                }
            }
        }

        if (!toSave.isEmpty()) {
            readingRepository.saveAll(toSave);
        }

        log.info("Reading batch complete: {} accepted, {} deduped, {} updated, {} rejected",
                accepted, deduped, updated, rejections.size());

        return BatchIngestResponse.builder()
            .accepted(accepted)
            .deduped(deduped)
            .updated(updated)
            .rejected(rejections.size())
            .rejections(rejections)
            .build();
    }

    /**
     * Rules:
     * - machineId and timestamp are required
     * - consumption must be finite and >= 0
     * - timestamp must not be more than 15 minutes in the future
     * - driver values must be finite (null values are dropped, not rejected)
     *
     * @return error message if invalid, null if valid
     */
    private String validateReading(ReadingDTO reading, Instant now) {
        if (reading == null) {
            return "INVALID_READING: reading is null";
        }
        if (reading.getMachineId() == null || reading.getMachineId().isBlank()) {
            return "INVALID_READING: machineId is required";
        }
        if (reading.getTimestamp() == null) {
            return "INVALID_READING: timestamp is required";
        }
        if (reading.getTimestamp().isAfter(now.plus(Duration.ofMinutes(MAX_FUTURE_MINUTES)))) {
            return "INVALID_READING: timestamp is more than 15 minutes in the future";
        }
        Double consumption = reading.getConsumption();
        if (consumption == null || !Double.isFinite(consumption) || consumption < 0) {
            return "INVALID_READING: consumption must be a finite value >= 0";
        }
        if (reading.getDrivers() != null) {
            for (Map.Entry<String, Double> driver : reading.getDrivers().entrySet()) {
                if (driver.getKey() == null || driver.getKey().isBlank()) {
                    return "INVALID_READING: driver name is required";
                }
                if (driver.getValue() != null && !Double.isFinite(driver.getValue())) {
                    return "INVALID_READING: driver '" + driver.getKey() + "' is not finite";
                }
            }
        }
        return null;
    }

    private Map<String, Double> cleanDrivers(Map<String, Double> drivers) {
        Map<String, Double> cleaned = new TreeMap<>();
        if (drivers != null) {
            drivers.forEach((name, value) -> {
                if (value != null) {
                    cleaned.put(name.trim(), value);
                }
            });
        }
        return cleaned;
    }

    /**
     * Hash of consumption plus sorted driver values. Machine and timestamp are the key
     * and receivedTime is server-controlled, so neither is part of the payload.
     */
    private String calculatePayloadHash(Double consumption, Map<String, Double> sortedDrivers) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String payload = consumption + "|" + sortedDrivers.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
            byte[] hash = digest.digest(payload.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
