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
 * Predictive performance of one model over one window. Append-only.
 */
@Entity
@Immutable
@Table(name = "performance_metrics",
    indexes = @Index(name = "idx_metric_model_kind_time", columnList = "modelId,kind,recordedAt"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private UUID modelId;

    @Column(nullable = false, length = 50)
    private String machineId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MetricKind kind;

    /**
     * Set for trial metrics only.
     */
    private UUID abTestId;

    @Column(nullable = false)
    private Instant windowStart;

    @Column(nullable = false)
    private Instant windowEnd;

    @Column(nullable = false)
    private long sampleCount;

    @Column(nullable = false)
    private double meanAbsoluteError;

    @Column(nullable = false)
    private double rootMeanSquaredError;

    /**
     * Null when the observed values in the window have no variance.
     */
    private Double rSquared;

    @Column(nullable = false)
    private Instant recordedAt;
}
