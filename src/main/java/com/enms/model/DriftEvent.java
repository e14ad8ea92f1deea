package com.enms.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of a drift evaluation that breached the degradation ratio.
 * Immutable once created.
 */
@Entity
@Immutable
@Table(name = "drift_events",
    indexes = @Index(name = "idx_drift_model_time", columnList = "modelId,detectedAt"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftEvent {

    public static final String METRIC_RMSE = "RMSE";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private UUID modelId;

    @Column(nullable = false, length = 50)
    private String machineId;

    @Column(nullable = false)
    private Instant detectedAt;

    /**
     * Evaluation error divided by training-time error.
     */
    @Column(nullable = false)
    private double degradationRatio;

    @Column(nullable = false, length = 20)
    private String triggeringMetric;

    @Column(nullable = false)
    private double evaluationError;

    @Column(nullable = false)
    private double baselineError;

    /**
     * Breaching evaluation cycles in a row, the current one included.
     */
    @Column(nullable = false)
    private int consecutiveBreaches;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DriftDecision decision;
}
