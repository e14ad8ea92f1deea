package com.enms.service;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.InsufficientDataException;
import com.enms.exception.InsufficientDriversException;
import com.enms.model.BaselineModel;
import com.enms.model.ModelStatus;
import com.enms.repository.BaselineModelRepository;
import com.enms.source.Reading;
import com.enms.source.TimeSeriesSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fits baseline models: ordinary least squares of consumption on a driver set
 * over a training window.
 *
 * Algorithm:
 * 1. Normalize the driver list (trim, drop blanks and duplicates), require the minimum count
 * 2. Read the window and drop buckets with a missing or non-finite driver or consumption
 * 3. Require the minimum number of remaining buckets
 * 4. Fit OLS with intercept, compute residuals (actual - predicted) on the training buckets
 * 5. Record residual mean/standard deviation and training RMSE, MAE and R²
 *
 * Fitting never touches stored models. {@link #store} assigns the next version
 * for the machine and persists a new row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BaselineTrainer {

    // QR diagonal entries at or below this mark the design matrix singular
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final TimeSeriesSource timeSeriesSource;
    private final BaselineModelRepository modelRepository;
    private final MachineLockRegistry machineLocks;
    private final AnalyticsProperties properties;

    /**
     * Fit and persist a new model with status TRAINING. The caller decides
     * whether it becomes active or challenger.
     */
    public BaselineModel trainBaseline(String machineId, Instant start, Instant end, List<String> drivers) {
        BaselineModel draft = fit(machineId, start, end, drivers);
        return store(draft, ModelStatus.TRAINING);
    }

    /**
     * Fit a model without persisting it. The returned draft has no id and no version.
     *
     * @throws InsufficientDriversException fewer drivers than configured
     * @throws InsufficientDataException    too few complete buckets, or drivers that
     *                                      cannot be separated (singular design matrix)
     */
    public BaselineModel fit(String machineId, Instant start, Instant end, List<String> drivers) {
        List<String> driverSet = normalizeDrivers(drivers);
        int minDrivers = properties.getTraining().getMinDrivers();
        if (driverSet.size() < minDrivers) {
            throw new InsufficientDriversException(String.format(
                "Baseline for %s needs at least %d distinct drivers, got %d %s",
                machineId, minDrivers, driverSet.size(), driverSet));
        }
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Training window must satisfy start < end, got [" + start + ", " + end + ")");
        }

        List<Reading> window = timeSeriesSource.readWindow(machineId, driverSet, start, end);
        List<Reading> complete = window.stream()
            .filter(r -> r.isComplete(driverSet))
            .collect(Collectors.toList());

        int minSamples = properties.getTraining().getMinSamples();
        if (complete.size() < minSamples) {
            throw new InsufficientDataException(String.format(
                "Baseline for %s needs at least %d complete buckets in [%s, %s), found %d of %d",
                machineId, minSamples, start, end, complete.size(), window.size()));
        }

        int n = complete.size();
        int p = driverSet.size();
        double[] y = new double[n];
        double[][] x = new double[n][p];
        for (int i = 0; i < n; i++) {
            Reading reading = complete.get(i);
            y[i] = reading.consumption();
            for (int j = 0; j < p; j++) {
                x[i][j] = reading.driverValues().get(driverSet.get(j));
            }
        }

        double[] beta;
        double[] residuals;
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            ols.newSampleData(y, x);
            beta = ols.estimateRegressionParameters();
            residuals = ols.estimateResiduals();
        } catch (SingularMatrixException e) {
            throw new InsufficientDataException(
                "Drivers " + driverSet + " are collinear or constant for machine " + machineId, e);
        } catch (MathIllegalArgumentException e) {
            throw new InsufficientDataException(
                "Cannot fit " + p + " drivers on " + n + " buckets for machine " + machineId, e);
        }

        Map<String, Double> coefficients = new HashMap<>();
        for (int j = 0; j < p; j++) {
            coefficients.put(driverSet.get(j), beta[j + 1]);
        }

        DescriptiveStatistics residualStats = new DescriptiveStatistics(residuals);
        double[] predicted = new double[n];
        for (int i = 0; i < n; i++) {
            predicted[i] = y[i] - residuals[i];
        }
        RegressionMetrics fitQuality = RegressionMetrics.of(y, predicted);

        double residualStd = residualStats.getStandardDeviation();
        if (!Double.isFinite(residualStd)) {
            residualStd = 0.0;
        }

        BaselineModel draft = BaselineModel.builder()
            .machineId(machineId)
            .coefficients(coefficients)
            .intercept(beta[0])
            .trainingStart(start)
            .trainingEnd(end)
            .residualMean(residualStats.getMean())
            .residualStd(residualStd)
            .trainingRmse(fitQuality.rootMeanSquaredError())
            .trainingMae(fitQuality.meanAbsoluteError())
            .rSquared(fitQuality.rSquared())
            .sampleCount(n)
            .status(ModelStatus.TRAINING)
            .build();

        Double r2 = fitQuality.rSquared();
        if (r2 == null || r2 < properties.getTraining().getMinRSquared()) {
            log.warn("Baseline for machine={} has R²={} below minimum {} ({} samples, drivers={})",
                machineId, r2, properties.getTraining().getMinRSquared(), n, driverSet);
        }
        log.info("Fitted baseline for machine={}: R²={}, RMSE={}, MAE={}, samples={}, dropped={}",
            machineId, r2, fitQuality.rootMeanSquaredError(), fitQuality.meanAbsoluteError(),
            n, window.size() - n);
        return draft;
    }

    /**
     * Persist a fitted draft as a new model row under the next version number.
     */
    public BaselineModel store(BaselineModel draft, ModelStatus status) {
        String machineId = draft.getMachineId();
        return machineLocks.withLock(machineId, () -> {
            int nextVersion = modelRepository.findMaxVersion(machineId) + 1;
            BaselineModel model = draft.toBuilder()
                .id(null)
                .version(nextVersion)
                .status(status)
                .coefficients(new HashMap<>(draft.getCoefficients()))
                .createdAt(Instant.now())
                .build();
            BaselineModel saved = modelRepository.save(model);
            log.info("Stored baseline model id={} machine={} version={} status={}",
                saved.getId(), machineId, nextVersion, status);
            return saved;
        });
    }

    private List<String> normalizeDrivers(List<String> drivers) {
        if (drivers == null) {
            return List.of();
        }
        return List.copyOf(drivers.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(d -> !d.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new)));
    }
}
