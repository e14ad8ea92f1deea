package com.enms.service;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;

/**
 * Error summary of predictions against observations.
 *
 * @param rSquared null when the observations have no variance
 */
public record RegressionMetrics(int sampleCount, double meanAbsoluteError, double rootMeanSquaredError, Double rSquared) {

    public static RegressionMetrics of(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException(
                "actual and predicted differ in length: " + actual.length + " vs " + predicted.length);
        }
        int n = actual.length;
        if (n == 0) {
            return new RegressionMetrics(0, 0.0, 0.0, null);
        }

        double[] residuals = MathArrays.ebeSubtract(actual, predicted);
        double[] absolute = Arrays.stream(residuals).map(Math::abs).toArray();
        double sumSq = StatUtils.sumSq(residuals);
        double sumTot = StatUtils.populationVariance(actual) * n;

        Double rSquared = sumTot > 0 ? 1.0 - sumSq / sumTot : null;
        return new RegressionMetrics(n, StatUtils.mean(absolute), Math.sqrt(sumSq / n), rSquared);
    }
}
