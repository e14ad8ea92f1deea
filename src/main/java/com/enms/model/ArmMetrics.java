package com.enms.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running error totals for one arm of an A/B trial.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArmMetrics {

    private long sampleCount;
    private double sumAbsoluteError;
    private double sumSquaredError;

    public void add(double residual) {
        sampleCount++;
        sumAbsoluteError += Math.abs(residual);
        sumSquaredError += residual * residual;
    }

    public double getMeanAbsoluteError() {
        return sampleCount == 0 ? 0.0 : sumAbsoluteError / sampleCount;
    }

    public double getRootMeanSquaredError() {
        return sampleCount == 0 ? 0.0 : Math.sqrt(sumSquaredError / sampleCount);
    }

    public static ArmMetrics empty() {
        return new ArmMetrics(0L, 0.0, 0.0);
    }
}
