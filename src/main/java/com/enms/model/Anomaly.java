package com.enms.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Scoring result for one reading, persisted for every severity so the
 * distribution can be audited. Severity is fixed at creation; only the
 * operator-facing resolution flag changes afterwards.
 */
@Entity
@Table(name = "anomalies", indexes = {
    @Index(name = "idx_anomaly_machine_time", columnList = "machineId,detectedAt"),
    @Index(name = "idx_anomaly_severity", columnList = "severity")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 50)
    private String machineId;

    @Column(nullable = false, updatable = false)
    private UUID modelId;

    /**
     * Timestamp of the scored reading.
     */
    @Column(nullable = false, updatable = false)
    private Instant detectedAt;

    @Column(nullable = false, updatable = false)
    private double observedValue;

    @Column(nullable = false, updatable = false)
    private double expectedValue;

    @Column(nullable = false, updatable = false)
    private double residual;

    @Column(nullable = false, updatable = false)
    private double residualZScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Severity severity;

    @Column(nullable = false, updatable = false)
    private double confidenceScore;

    @Column(nullable = false, updatable = false)
    private double deviationPercent;

    /**
     * Set when the model's residual deviation was floored to avoid dividing by zero.
     */
    @Column(nullable = false, updatable = false)
    private boolean degenerateModel;

    @Column(nullable = false)
    private boolean resolved;

    private Instant resolvedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public void resolve(Instant now) {
        this.resolved = true;
        this.resolvedAt = now;
    }
}
