package com.enms.repository;

import com.enms.model.EnergyReading;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for stored energy readings.
 *
 * Provides:
 * - window queries for training and drift evaluation (start inclusive, end exclusive)
 * - latest reading lookup for the anomaly scan
 * - bulk lookup by machine for batch ingest dedupe
 */
@Repository
public interface EnergyReadingRepository extends JpaRepository<EnergyReading, UUID> {

    @Query("SELECT r FROM EnergyReading r WHERE r.machineId = :machineId " +
           "AND r.timestamp >= :start AND r.timestamp < :end ORDER BY r.timestamp")
    List<EnergyReading> findWindow(
        @Param("machineId") String machineId,
        @Param("start") Instant start,
        @Param("end") Instant end
    );

    Optional<EnergyReading> findFirstByMachineIdOrderByTimestampDesc(String machineId);

    Optional<EnergyReading> findByMachineIdAndTimestamp(String machineId, Instant timestamp);

    List<EnergyReading> findByMachineIdAndTimestampIn(String machineId, Collection<Instant> timestamps);

    long countByMachineId(String machineId);
}
