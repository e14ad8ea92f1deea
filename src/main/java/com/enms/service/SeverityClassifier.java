package com.enms.service;

import com.enms.config.AnalyticsProperties;
import com.enms.model.Severity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps a residual z-score to severity and anomaly confidence.
 *
 * Thresholds are inclusive toward the higher severity:
 *   |z| < warning            -> NORMAL
 *   warning <= |z| < critical -> WARNING
 *   |z| >= critical          -> CRITICAL
 */
@Component
public class SeverityClassifier {

    private final double warningZ;
    private final double criticalZ;
    private final double confidenceScale;

    @Autowired
    public SeverityClassifier(AnalyticsProperties properties) {
        this(properties.getScoring().getWarningZ(),
             properties.getScoring().getCriticalZ(),
             properties.getScoring().getConfidenceScale());
    }

    public SeverityClassifier(double warningZ, double criticalZ, double confidenceScale) {
        if (warningZ <= 0 || criticalZ < warningZ) {
            throw new IllegalArgumentException(
                "Severity thresholds must satisfy 0 < warning <= critical, got " + warningZ + "/" + criticalZ);
        }
        if (confidenceScale <= 0) {
            throw new IllegalArgumentException("Confidence scale must be positive, got " + confidenceScale);
        }
        this.warningZ = warningZ;
        this.criticalZ = criticalZ;
        this.confidenceScale = confidenceScale;
    }

    public Severity classify(double zScore) {
        double magnitude = Math.abs(zScore);
        if (magnitude >= criticalZ) {
            return Severity.CRITICAL;
        }
        if (magnitude >= warningZ) {
            return Severity.WARNING;
        }
        return Severity.NORMAL;
    }

    /**
     * 1 - exp(-|z| / k): 0 at z = 0, increasing toward 1.
     */
    public double confidence(double zScore) {
        double value = 1.0 - Math.exp(-Math.abs(zScore) / confidenceScale);
        return Math.max(0.0, Math.min(1.0, value));
    }
}
