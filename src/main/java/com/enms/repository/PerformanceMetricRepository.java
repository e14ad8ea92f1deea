package com.enms.repository;

import com.enms.model.MetricKind;
import com.enms.model.PerformanceMetric;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PerformanceMetricRepository extends JpaRepository<PerformanceMetric, UUID> {

    /**
     * Most recent metrics of a kind for a model, newest first.
     */
    @Query("SELECT m FROM PerformanceMetric m WHERE m.modelId = :modelId AND m.kind = :kind " +
           "ORDER BY m.recordedAt DESC")
    List<PerformanceMetric> findRecent(
        @Param("modelId") UUID modelId,
        @Param("kind") MetricKind kind,
        Pageable pageable
    );

    List<PerformanceMetric> findByAbTestId(UUID abTestId);
}
