package com.enms.support;

import com.enms.model.BaselineModel;
import com.enms.model.ModelStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Hand-built model drafts with known statistics. Store them through
 * BaselineTrainer.store so they get a version.
 */
public final class TestModels {

    private TestModels() {
    }

    /**
     * Model predicting a constant: every driver coefficient is zero.
     */
    public static BaselineModel constant(String machineId, double intercept, double residualStd, double trainingRmse) {
        Map<String, Double> coefficients = new HashMap<>();
        for (String driver : TestReadings.DRIVERS) {
            coefficients.put(driver, 0.0);
        }
        Instant end = Instant.now();
        return BaselineModel.builder()
            .machineId(machineId)
            .coefficients(coefficients)
            .intercept(intercept)
            .trainingStart(end.minus(Duration.ofDays(30)))
            .trainingEnd(end)
            .residualMean(0.0)
            .residualStd(residualStd)
            .trainingRmse(trainingRmse)
            .trainingMae(trainingRmse)
            .rSquared(0.9)
            .sampleCount(30)
            .status(ModelStatus.TRAINING)
            .build();
    }
}
