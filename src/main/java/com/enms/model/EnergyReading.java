package com.enms.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One time bucket of energy consumption for a machine, together with the
 * driver values observed in the same bucket.
 *
 * Key design decisions:
 * - (machineId, timestamp) is unique: a bucket is ingested once and later updated in place
 * - payloadHash distinguishes a duplicate delivery from a corrected one
 * - a driver missing from driverValues means "not measured" for that bucket
 */
@Entity
@Table(name = "energy_readings",
    uniqueConstraints = @UniqueConstraint(name = "uk_reading_machine_time", columnNames = {"machineId", "timestamp"}),
    indexes = @Index(name = "idx_reading_machine_time", columnList = "machineId,timestamp"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergyReading {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 50)
    private String machineId;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private Instant receivedTime;

    /**
     * Energy consumed in the bucket (kWh).
     */
    @Column(nullable = false)
    private Double consumption;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "energy_reading_drivers", joinColumns = @JoinColumn(name = "reading_id"))
    @MapKeyColumn(name = "driver", length = 100)
    @Column(name = "driver_value")
    @Builder.Default
    private Map<String, Double> driverValues = new HashMap<>();

    @Column(nullable = false)
    private String payloadHash;

    @Version
    private Long version;
}
