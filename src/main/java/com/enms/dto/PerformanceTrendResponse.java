package com.enms.dto;

import com.enms.model.TrendDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Direction of the active model's R² across its recent evaluation windows.
 *
 * Fields:
 * - slope: least-squares slope of R² per evaluation, 0 with fewer than two points
 * - points: evaluations oldest first
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceTrendResponse {

    private String machineId;
    private UUID modelId;
    private TrendDirection direction;
    private double slope;

    @Builder.Default
    private List<Point> points = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        private Instant recordedAt;
        private long sampleCount;
        private double meanAbsoluteError;
        private double rootMeanSquaredError;
        private Double rSquared;
    }
}
