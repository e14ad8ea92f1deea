package com.enms.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Operator notification raised on an anomaly or on a drift/retraining problem.
 * Lives until acknowledged.
 */
@Entity
@Table(name = "alerts", indexes = {
    @Index(name = "idx_alert_open", columnList = "acknowledged,createdAt"),
    @Index(name = "idx_alert_machine", columnList = "machineId")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertSource source;

    @Column(nullable = false, length = 50)
    private String machineId;

    /**
     * Anomaly id, drift event id or retrain job id depending on the source.
     */
    @Column(nullable = false)
    private UUID referenceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Column(nullable = false, length = 500)
    private String message;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private boolean acknowledged;

    private Instant acknowledgedAt;

    public void acknowledge(Instant now) {
        this.acknowledged = true;
        this.acknowledgedAt = now;
    }
}
