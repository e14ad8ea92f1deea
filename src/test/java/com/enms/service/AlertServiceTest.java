package com.enms.service;

import com.enms.exception.ResourceNotFoundException;
import com.enms.model.Alert;
import com.enms.model.AlertSource;
import com.enms.model.Severity;
import com.enms.support.DatabaseCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AlertServiceTest {

    @Autowired
    private AlertService alertService;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
    }

    @Test
    void testFiltersAndAcknowledge() {
        Alert warning = alertService.raise(AlertSource.ANOMALY, "M-1", UUID.randomUUID(), Severity.WARNING, "warn");
        alertService.raise(AlertSource.ANOMALY, "M-1", UUID.randomUUID(), Severity.CRITICAL, "crit");
        alertService.raise(AlertSource.DRIFT, "M-2", UUID.randomUUID(), Severity.WARNING, "drift");

        assertEquals(3, alertService.listActiveAlerts(null, null, null, null).size());
        assertEquals(2, alertService.listActiveAlerts(null, "M-1", null, null).size());
        assertEquals(2, alertService.listActiveAlerts(Severity.WARNING, null, null, null).size());
        assertEquals(0, alertService.listActiveAlerts(null, null, null, Instant.now().minus(1, ChronoUnit.HOURS)).size());

        Alert acknowledged = alertService.acknowledge(warning.getId());
        assertTrue(acknowledged.isAcknowledged());
        assertNotNull(acknowledged.getAcknowledgedAt());

        List<Alert> remaining = alertService.listActiveAlerts(null, "M-1", null, null);
        assertEquals(1, remaining.size());
        assertEquals(Severity.CRITICAL, remaining.get(0).getSeverity());
    }

    @Test
    void testLongMessageTruncated() {
        Alert alert = alertService.raise(AlertSource.DRIFT, "M-1", UUID.randomUUID(), Severity.WARNING, "x".repeat(800));

        assertEquals(500, alert.getMessage().length());
    }

    @Test
    void testUnknownAlert() {
        assertThrows(ResourceNotFoundException.class, () -> alertService.acknowledge(UUID.randomUUID()));
    }
}
