package com.enms.model;

import com.enms.exception.InvalidReadingException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Versioned linear baseline of energy consumption on a set of drivers:
 *
 *   expected = intercept + sum(coefficient[d] * value[d])
 *
 * Everything except {@link #status} is fixed when the model is trained.
 * Residual statistics are the reference for z-scoring and are never recomputed.
 */
@Entity
@Table(name = "baseline_models",
    uniqueConstraints = @UniqueConstraint(name = "uk_model_machine_version", columnNames = {"machineId", "version"}),
    indexes = @Index(name = "idx_model_machine_status", columnList = "machineId,status"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BaselineModel {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 50)
    private String machineId;

    /**
     * Monotonic per machine, assigned when the model is stored.
     */
    @Column(nullable = false, updatable = false)
    private Integer version;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "baseline_model_coefficients", joinColumns = @JoinColumn(name = "model_id"))
    @MapKeyColumn(name = "driver", length = 100)
    @Column(name = "coefficient", nullable = false)
    @Builder.Default
    private Map<String, Double> coefficients = new HashMap<>();

    @Column(nullable = false, updatable = false)
    private double intercept;

    /** Inclusive. */
    @Column(nullable = false, updatable = false)
    private Instant trainingStart;

    /** Exclusive. */
    @Column(nullable = false, updatable = false)
    private Instant trainingEnd;

    @Column(nullable = false, updatable = false)
    private double residualMean;

    @Column(nullable = false, updatable = false)
    private double residualStd;

    @Column(nullable = false, updatable = false)
    private double trainingRmse;

    @Column(nullable = false, updatable = false)
    private double trainingMae;

    @Column(updatable = false)
    private Double rSquared;

    @Column(nullable = false, updatable = false)
    private int sampleCount;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ModelStatus status;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long lockVersion;

    /**
     * Driver names in a stable (sorted) order.
     */
    public List<String> getDrivers() {
        List<String> drivers = new ArrayList<>(coefficients.keySet());
        Collections.sort(drivers);
        return drivers;
    }

    /**
     * Expected consumption for the given driver values.
     *
     * @throws InvalidReadingException if a model driver has no value
     */
    public double predict(Map<String, Double> driverValues) {
        double expected = intercept;
        for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
            Double value = driverValues == null ? null : driverValues.get(entry.getKey());
            if (value == null || !Double.isFinite(value)) {
                throw new InvalidReadingException(
                    "Reading has no value for driver '" + entry.getKey() + "' required by model " + id);
            }
            expected += entry.getValue() * value;
        }
        return expected;
    }

    /**
     * True when every model driver has a finite value in the map.
     */
    public boolean canPredict(Map<String, Double> driverValues) {
        if (driverValues == null) {
            return coefficients.isEmpty();
        }
        return coefficients.keySet().stream()
            .map(driverValues::get)
            .allMatch(v -> v != null && Double.isFinite(v));
    }
}
