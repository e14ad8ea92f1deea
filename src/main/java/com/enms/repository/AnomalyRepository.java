package com.enms.repository;

import com.enms.model.Anomaly;
import com.enms.model.Severity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AnomalyRepository extends JpaRepository<Anomaly, UUID> {

    boolean existsByMachineIdAndDetectedAt(String machineId, Instant detectedAt);

    List<Anomaly> findByMachineIdOrderByDetectedAtDesc(String machineId);

    /**
     * Filtered listing; null parameters are ignored.
     */
    @Query("SELECT a FROM Anomaly a WHERE (:machineId IS NULL OR a.machineId = :machineId) " +
           "AND (:severity IS NULL OR a.severity = :severity) " +
           "AND (:unresolvedOnly = false OR a.resolved = false) " +
           "ORDER BY a.detectedAt DESC")
    List<Anomaly> search(
        @Param("machineId") String machineId,
        @Param("severity") Severity severity,
        @Param("unresolvedOnly") boolean unresolvedOnly
    );
}
