package com.enms.scheduler;

import com.enms.dto.MachineRequest;
import com.enms.model.ModelStatus;
import com.enms.model.RetrainJob;
import com.enms.model.RetrainJobState;
import com.enms.model.RetrainTrigger;
import com.enms.repository.AnomalyRepository;
import com.enms.repository.EnergyReadingRepository;
import com.enms.repository.RetrainJobRepository;
import com.enms.service.AbTestManager;
import com.enms.service.BaselineTrainer;
import com.enms.service.MachineService;
import com.enms.service.ModelActivationService;
import com.enms.support.DatabaseCleaner;
import com.enms.support.TestModels;
import com.enms.support.TestReadings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fleet jobs run directly, without the scheduler. Machine A has an active
 * model and one reading, machine B a reading but no model, machine C nothing.
 *
 * Tests cover:
 * 1. Anomaly scan scores each machine once and reports skips by reason
 * 2. Scheduled retrain skips fresh models and enqueues the rest
 * 3. Drift check isolates per-machine failures
 * 4. A/B evaluation leaves trials that are not due
 * 5. Inactive machines are not visited
 */
@SpringBootTest
@ActiveProfiles("test")
class ScheduledJobsTest {

    private static final String MACHINE_A = "LINE-A";
    private static final String MACHINE_B = "LINE-B";
    private static final String MACHINE_C = "LINE-C";

    @MockBean(name = "retrainExecutor")
    private Executor retrainExecutor;

    @Autowired
    private AnomalyScanJob anomalyScanJob;

    @Autowired
    private ScheduledRetrainJob scheduledRetrainJob;

    @Autowired
    private DriftCheckJob driftCheckJob;

    @Autowired
    private AbEvaluationJob abEvaluationJob;

    @Autowired
    private MachineService machineService;

    @Autowired
    private BaselineTrainer trainer;

    @Autowired
    private ModelActivationService activationService;

    @Autowired
    private AbTestManager abTestManager;

    @Autowired
    private EnergyReadingRepository readingRepository;

    @Autowired
    private AnomalyRepository anomalyRepository;

    @Autowired
    private RetrainJobRepository jobRepository;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
        for (String machineId : List.of(MACHINE_A, MACHINE_B, MACHINE_C)) {
            machineService.register(machineId, MachineRequest.builder().name(machineId).type("compressor").build());
        }
        activationService.activateFirst(
            trainer.store(TestModels.constant(MACHINE_A, 100.0, 1.0, 1.0), ModelStatus.TRAINING));

        Instant timestamp = Instant.now().minus(10, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.SECONDS);
        readingRepository.save(TestReadings.reading(MACHINE_A, timestamp, 100.5, TestReadings.drivers(1, 1, 1)));
        readingRepository.save(TestReadings.reading(MACHINE_B, timestamp, 80.0, TestReadings.drivers(1, 1, 1)));
    }

    /**
     * Test 1: A scored, B NO_ACTIVE_MODEL, C NO_DATA; a second scan reports A as DUPLICATE
     */
    @Test
    void testAnomalyScan() {
        BatchReport first = anomalyScanJob.run();

        assertEquals(3, first.getProcessed());
        assertEquals(1, first.getSucceeded());
        assertEquals("NO_ACTIVE_MODEL", first.getSkipped().get(MACHINE_B));
        assertEquals("NO_DATA", first.getSkipped().get(MACHINE_C));
        assertEquals(1, anomalyRepository.count());

        BatchReport second = anomalyScanJob.run();

        assertEquals(0, second.getSucceeded());
        assertEquals(AnomalyScanJob.DUPLICATE, second.getSkipped().get(MACHINE_A));
        assertEquals(1, anomalyRepository.count());
    }

    /**
     * Test 2: Fresh model on A → UP_TO_DATE; B and C get a queued SCHEDULED job
     */
    @Test
    void testScheduledRetrain() {
        BatchReport report = scheduledRetrainJob.run();

        assertEquals(2, report.getSucceeded());
        assertEquals(ScheduledRetrainJob.UP_TO_DATE, report.getSkipped().get(MACHINE_A));
        assertTrue(jobRepository.findByMachineIdOrderByCreatedAtDesc(MACHINE_A).isEmpty());
        for (String machineId : List.of(MACHINE_B, MACHINE_C)) {
            RetrainJob job = jobRepository.findByMachineIdOrderByCreatedAtDesc(machineId).get(0);
            assertEquals(RetrainTrigger.SCHEDULED, job.getTriggerType());
            assertEquals(RetrainJobState.QUEUED, job.getState());
        }
    }

    /**
     * Test 3: Every machine fails its own way and all three are reported
     */
    @Test
    void testDriftCheckIsolatesFailures() {
        BatchReport report = driftCheckJob.run();

        assertEquals(3, report.getProcessed());
        assertEquals(0, report.getSucceeded());
        assertEquals("INSUFFICIENT_DATA", report.getSkipped().get(MACHINE_A));
        assertEquals("NO_ACTIVE_MODEL", report.getSkipped().get(MACHINE_B));
        assertEquals("NO_ACTIVE_MODEL", report.getSkipped().get(MACHINE_C));
    }

    /**
     * Test 4: A trial whose window is still open is not decided
     */
    @Test
    void testAbEvaluationSkipsOpenTrials() {
        abTestManager.startAbTest(MACHINE_A,
            trainer.store(TestModels.constant(MACHINE_A, 99.0, 1.0, 1.0), ModelStatus.TRAINING).getId());

        BatchReport report = abEvaluationJob.run();

        assertEquals(0, report.getProcessed());
        assertTrue(abTestManager.findDueTests(Instant.now()).isEmpty());
    }

    /**
     * Test 5: Deactivated machine is left out of every fleet job
     */
    @Test
    void testInactiveMachineSkipped() {
        machineService.register(MACHINE_C, MachineRequest.builder().name(MACHINE_C).active(false).build());

        BatchReport report = driftCheckJob.run();

        assertEquals(2, report.getProcessed());
        assertFalse(report.getSkipped().containsKey(MACHINE_C));
    }
}
