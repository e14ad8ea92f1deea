package com.enms.service;

import com.enms.dto.BatchIngestResponse;
import com.enms.dto.ReadingDTO;
import com.enms.model.EnergyReading;
import com.enms.repository.EnergyReadingRepository;
import com.enms.support.DatabaseCleaner;
import com.enms.support.TestReadings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ReadingIngestService.
 *
 * Tests cover:
 * 1. Identical re-delivery deduplication
 * 2. Corrected payload updates the stored bucket in place
 * 3. Future timestamp rejection
 * 4. Negative and non-finite consumption rejection
 * 5. Repeats of one bucket within a batch, last one wins
 * 6. Null driver values are dropped, not rejected
 * 7. Thread-safety with concurrent ingestion
 */
@SpringBootTest
@ActiveProfiles("test")
class ReadingIngestServiceTest {

    @Autowired
    private ReadingIngestService ingestService;

    @Autowired
    private EnergyReadingRepository readingRepository;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
    }

    /**
     * Test 1: Identical bucket delivered twice → deduped
     */
    @Test
    void testIdenticalDuplicateIsDeduped() {
        ReadingDTO reading = reading("M-001", hourAgo(), 120.5, TestReadings.drivers(40, 12.5, 6.1));

        BatchIngestResponse response1 = ingestService.ingestBatch(List.of(reading));
        assertEquals(1, response1.getAccepted());
        assertEquals(0, response1.getDeduped());

        BatchIngestResponse response2 = ingestService.ingestBatch(List.of(reading));
        assertEquals(0, response2.getAccepted());
        assertEquals(1, response2.getDeduped());

        assertEquals(1, readingRepository.countByMachineId("M-001"));
    }

    /**
     * Test 2: Same bucket with a corrected payload → updated in place
     */
    @Test
    void testCorrectedPayloadUpdatesBucket() {
        Instant timestamp = hourAgo();
        ingestService.ingestBatch(List.of(reading("M-001", timestamp, 120.5, TestReadings.drivers(40, 12.5, 6.1))));

        BatchIngestResponse response = ingestService.ingestBatch(
            List.of(reading("M-001", timestamp, 131.0, TestReadings.drivers(44, 12.5, 6.1))));

        assertEquals(0, response.getAccepted());
        assertEquals(1, response.getUpdated());

        EnergyReading stored = readingRepository.findByMachineIdAndTimestamp("M-001", timestamp).orElseThrow();
        assertEquals(131.0, stored.getConsumption());
        assertEquals(44.0, stored.getDriverValues().get(TestReadings.PRODUCTION));
        assertEquals(1, readingRepository.countByMachineId("M-001"));
    }

    /**
     * Test 3: Timestamp more than 15 minutes ahead → rejected
     */
    @Test
    void testFutureTimestampRejected() {
        ReadingDTO future = reading("M-001", Instant.now().plus(20, ChronoUnit.MINUTES), 80.0,
            TestReadings.drivers(10, 10, 5));
        ReadingDTO nearFuture = reading("M-001", Instant.now().plus(5, ChronoUnit.MINUTES), 80.0,
            TestReadings.drivers(10, 10, 5));

        BatchIngestResponse response = ingestService.ingestBatch(List.of(future, nearFuture));

        assertEquals(1, response.getAccepted());
        assertEquals(1, response.getRejected());
        assertTrue(response.getRejections().get(0).getReason().startsWith("INVALID_READING"));
    }

    /**
     * Test 4: Negative, infinite and missing consumption → rejected, rest of batch accepted
     */
    @Test
    void testInvalidConsumptionRejected() {
        Instant base = hourAgo();
        List<ReadingDTO> batch = List.of(
            reading("M-001", base, -1.0, TestReadings.drivers(1, 1, 1)),
            reading("M-001", base.plusSeconds(60), Double.POSITIVE_INFINITY, TestReadings.drivers(1, 1, 1)),
            reading("M-001", base.plusSeconds(120), null, TestReadings.drivers(1, 1, 1)),
            reading("M-001", base.plusSeconds(180), 0.0, TestReadings.drivers(1, 1, 1)));

        BatchIngestResponse response = ingestService.ingestBatch(batch);

        assertEquals(1, response.getAccepted());
        assertEquals(3, response.getRejected());
        assertEquals(1, readingRepository.countByMachineId("M-001"));
    }

    /**
     * Test 5: Two readings for one bucket in a batch → last one stored, first counted as deduped
     */
    @Test
    void testRepeatWithinBatchLastOneWins() {
        Instant timestamp = hourAgo();
        BatchIngestResponse response = ingestService.ingestBatch(List.of(
            reading("M-001", timestamp, 100.0, TestReadings.drivers(1, 1, 1)),
            reading("M-001", timestamp, 105.0, TestReadings.drivers(1, 1, 1))));

        assertEquals(1, response.getAccepted());
        assertEquals(1, response.getDeduped());
        assertEquals(105.0,
            readingRepository.findByMachineIdAndTimestamp("M-001", timestamp).orElseThrow().getConsumption());
    }

    /**
     * Test 6: A driver reported as null means "not measured" and is not stored
     */
    @Test
    void testNullDriverValueDropped() {
        Instant timestamp = hourAgo();
        Map<String, Double> drivers = new HashMap<>(TestReadings.drivers(1, 2, 3));
        drivers.put(TestReadings.PRESSURE, null);

        BatchIngestResponse response = ingestService.ingestBatch(List.of(reading("M-001", timestamp, 50.0, drivers)));

        assertEquals(1, response.getAccepted());
        EnergyReading stored = readingRepository.findByMachineIdAndTimestamp("M-001", timestamp).orElseThrow();
        assertFalse(stored.getDriverValues().containsKey(TestReadings.PRESSURE));
        assertEquals(2, stored.getDriverValues().size());
    }

    /**
     * Test 7: Concurrent batches for different machines → every bucket stored exactly once
     */
    @Test
    void testConcurrentIngestion() throws Exception {
        int threads = 8;
        int perThread = 25;
        Instant base = Instant.now().minus(1, ChronoUnit.DAYS);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<BatchIngestResponse>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String machineId = "M-" + (100 + t);
                List<ReadingDTO> batch = IntStream.range(0, perThread)
                    .mapToObj(i -> reading(machineId, base.plusSeconds(60L * i), 10.0 + i, TestReadings.driversAt(i)))
                    .collect(Collectors.toList());
                tasks.add(() -> ingestService.ingestBatch(batch));
            }

            int accepted = 0;
            for (Future<BatchIngestResponse> future : executor.invokeAll(tasks)) {
                accepted += future.get(30, TimeUnit.SECONDS).getAccepted();
            }

            assertEquals(threads * perThread, accepted);
            assertEquals(threads * perThread, readingRepository.count());
        } finally {
            executor.shutdownNow();
        }
    }

    private static Instant hourAgo() {
        return Instant.now().minus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);
    }

    private static ReadingDTO reading(String machineId, Instant timestamp, Double consumption, Map<String, Double> drivers) {
        return ReadingDTO.builder()
            .machineId(machineId)
            .timestamp(timestamp)
            .consumption(consumption)
            .drivers(drivers)
            .build();
    }
}
