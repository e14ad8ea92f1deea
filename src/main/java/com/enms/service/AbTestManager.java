package com.enms.service;

import com.enms.config.AnalyticsProperties;
import com.enms.exception.ConflictException;
import com.enms.exception.IllegalStateTransitionException;
import com.enms.exception.InsufficientTrialDataException;
import com.enms.exception.ResourceNotFoundException;
import com.enms.model.AbTest;
import com.enms.model.AbTestStatus;
import com.enms.model.ArmMetrics;
import com.enms.model.BaselineModel;
import com.enms.model.MetricKind;
import com.enms.model.ModelStatus;
import com.enms.model.PerformanceMetric;
import com.enms.repository.AbTestRepository;
import com.enms.repository.PerformanceMetricRepository;
import com.enms.source.Reading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs trials between the active (incumbent) model and a challenger.
 *
 * While a trial runs, the anomaly scorer hands every incumbent residual to
 * {@link #recordTrialSample}; the challenger is scored on the same reading for
 * evaluation only. A decision compares mean absolute error:
 * - fewer samples than the guard on either arm: extend once, then keep the incumbent
 * - challenger MAE lower by more than the tie epsilon: challenger wins and is swapped in
 * - otherwise the incumbent stays and the challenger is retired
 *
 * Opening and deciding trials run under the machine lock, inside one transaction
 * each, so promotion never interleaves with drift evaluation or retraining.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AbTestManager {

    private final AbTestRepository abTestRepository;
    private final PerformanceMetricRepository metricRepository;
    private final ModelActivationService activationService;
    private final MachineLockRegistry machineLocks;
    private final TransactionTemplate transactionTemplate;
    private final AnalyticsProperties properties;

    /**
     * Open a trial for an externally chosen challenger. Fails with a conflict if
     * the machine already has a running trial.
     */
    public AbTest startAbTest(String machineId, UUID challengerModelId) {
        return openTrial(machineId, challengerModelId, false);
    }

    /**
     * Open a trial, optionally superseding a running one. A superseded trial is
     * decided for its incumbent and its challenger retired.
     */
    public AbTest openTrial(String machineId, UUID challengerModelId, boolean supersede) {
        return machineLocks.withLock(machineId, () -> transactionTemplate.execute(status -> {
            BaselineModel incumbent = activationService.requireActive(machineId);
            BaselineModel challenger = activationService.getModel(challengerModelId);
            if (!challenger.getMachineId().equals(machineId)) {
                throw new ConflictException("Model " + challengerModelId + " belongs to machine " + challenger.getMachineId());
            }
            if (challenger.getId().equals(incumbent.getId())) {
                throw new ConflictException("Model " + challengerModelId + " is already the active model");
            }
            if (challenger.getStatus() != ModelStatus.TRAINING && challenger.getStatus() != ModelStatus.CHALLENGER) {
                throw new ConflictException("Model " + challengerModelId + " has status " + challenger.getStatus()
                    + " and cannot enter a trial");
            }

            Optional<AbTest> running = abTestRepository.findRunningForUpdate(machineId);
            if (running.isPresent()) {
                if (!supersede) {
                    throw new ConflictException("Machine " + machineId + " already has running A/B test " + running.get().getId());
                }
                supersedeRunning(running.get(), challengerModelId);
            }

            activationService.markChallenger(challengerModelId);
            Instant now = Instant.now();
            AbTest test = abTestRepository.save(AbTest.builder()
                .machineId(machineId)
                .incumbentModelId(incumbent.getId())
                .challengerModelId(challengerModelId)
                .startedAt(now)
                .endsAt(now.plus(properties.getAbTest().getTrialWindow()))
                .extended(false)
                .status(AbTestStatus.RUNNING)
                .build());
            log.info("Opened A/B test {} for machine {}: incumbent={} (v{}) challenger={} (v{}) until {}",
                test.getId(), machineId, incumbent.getId(), incumbent.getVersion(),
                challengerModelId, challenger.getVersion(), test.getEndsAt());
            return test;
        }));
    }

    /**
     * Score a reading with the challenger of the machine's running trial and add
     * both residuals to the trial totals. No-op without a running trial, when the
     * trial's incumbent is not the model that scored the reading, or when the
     * reading lacks a challenger driver.
     */
    @Transactional
    public void recordTrialSample(String machineId, UUID incumbentModelId, double incumbentResidual, Reading reading) {
        Optional<AbTest> running = abTestRepository.findRunningForUpdate(machineId);
        if (running.isEmpty()) {
            return;
        }
        AbTest test = running.get();
        if (!test.getIncumbentModelId().equals(incumbentModelId)) {
            log.debug("Skipping trial sample for test {}: scored by {} instead of incumbent {}",
                test.getId(), incumbentModelId, test.getIncumbentModelId());
            return;
        }
        BaselineModel challenger = activationService.getModel(test.getChallengerModelId());
        if (!challenger.canPredict(reading.driverValues())) {
            log.debug("Skipping trial sample for test {}: reading at {} lacks challenger drivers {}",
                test.getId(), reading.timestamp(), challenger.getDrivers());
            return;
        }
        double challengerResidual = reading.consumption() - challenger.predict(reading.driverValues());
        test.recordSample(incumbentResidual, challengerResidual);
        abTestRepository.save(test);
    }

    /**
     * Decide a trial now.
     *
     * @throws InsufficientTrialDataException when an arm is short of samples and
     *                                        the trial was extended instead (committed)
     * @throws IllegalStateTransitionException when the trial is already decided
     */
    public AbTest decide(UUID testId) {
        String machineId = getAbTest(testId).getMachineId();
        Decision decision = machineLocks.withLock(machineId,
            () -> transactionTemplate.execute(status -> decideLocked(testId)));
        if (decision.extended()) {
            throw new InsufficientTrialDataException(decision.message());
        }
        return decision.test();
    }

    /**
     * Running trials whose window has ended.
     */
    @Transactional(readOnly = true)
    public List<AbTest> findDueTests(Instant now) {
        return abTestRepository.findByStatus(AbTestStatus.RUNNING).stream()
            .filter(t -> t.isDue(now))
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public AbTest getAbTest(UUID testId) {
        return abTestRepository.findById(testId)
            .orElseThrow(() -> new ResourceNotFoundException("A/B test " + testId + " not found"));
    }

    private Decision decideLocked(UUID testId) {
        AbTest test = abTestRepository.findByIdForUpdate(testId)
            .orElseThrow(() -> new ResourceNotFoundException("A/B test " + testId + " not found"));
        if (test.getStatus() == AbTestStatus.DECIDED) {
            throw new IllegalStateTransitionException(
                "A/B test " + testId + " is already decided for model " + test.getWinnerModelId());
        }

        ArmMetrics incumbentArm = test.getIncumbentMetrics();
        ArmMetrics challengerArm = test.getChallengerMetrics();
        long samples = Math.min(incumbentArm.getSampleCount(), challengerArm.getSampleCount());
        int minSamples = properties.getAbTest().getMinSamples();

        UUID winner;
        String note;
        if (samples < minSamples) {
            if (!test.isExtended()) {
                test.extendBy(properties.getAbTest().getTrialWindow());
                abTestRepository.save(test);
                String message = String.format(
                    "A/B test %s has %d of %d required samples per arm, extended until %s",
                    testId, samples, minSamples, test.getEndsAt());
                log.warn(message);
                return new Decision(test, true, message);
            }
            winner = test.getIncumbentModelId();
            note = String.format("Insufficient trial data after extension (%d of %d samples), incumbent kept",
                samples, minSamples);
        } else {
            double incumbentMae = incumbentArm.getMeanAbsoluteError();
            double challengerMae = challengerArm.getMeanAbsoluteError();
            if (incumbentMae - challengerMae > properties.getAbTest().getTieEpsilon()) {
                winner = test.getChallengerModelId();
                note = String.format("Challenger MAE %.4f beats incumbent MAE %.4f", challengerMae, incumbentMae);
            } else {
                winner = test.getIncumbentModelId();
                note = String.format("Incumbent MAE %.4f kept against challenger MAE %.4f", incumbentMae, challengerMae);
            }
        }

        Instant now = Instant.now();
        test.decide(winner, note, now);
        abTestRepository.save(test);
        appendArmMetrics(test, now);

        if (winner.equals(test.getChallengerModelId())) {
            activationService.swap(test.getMachineId(), test.getIncumbentModelId(), test.getChallengerModelId());
        } else {
            activationService.retire(test.getChallengerModelId());
        }
        log.info("Decided A/B test {} for machine {}: winner={} ({})", testId, test.getMachineId(), winner, note);
        return new Decision(test, false, note);
    }

    private void supersedeRunning(AbTest running, UUID newChallengerId) {
        Instant now = Instant.now();
        running.decide(running.getIncumbentModelId(), "Superseded by challenger " + newChallengerId, now);
        abTestRepository.save(running);
        appendArmMetrics(running, now);
        if (!running.getChallengerModelId().equals(newChallengerId)) {
            activationService.retire(running.getChallengerModelId());
        }
        log.info("Superseded A/B test {} for machine {} by challenger {}",
            running.getId(), running.getMachineId(), newChallengerId);
    }

    private void appendArmMetrics(AbTest test, Instant now) {
        metricRepository.save(armMetric(test, test.getIncumbentModelId(), MetricKind.TRIAL_INCUMBENT,
            test.getIncumbentMetrics(), now));
        metricRepository.save(armMetric(test, test.getChallengerModelId(), MetricKind.TRIAL_CHALLENGER,
            test.getChallengerMetrics(), now));
    }

    private PerformanceMetric armMetric(AbTest test, UUID modelId, MetricKind kind, ArmMetrics arm, Instant now) {
        return PerformanceMetric.builder()
            .modelId(modelId)
            .machineId(test.getMachineId())
            .kind(kind)
            .abTestId(test.getId())
            .windowStart(test.getStartedAt())
            .windowEnd(now)
            .sampleCount(arm.getSampleCount())
            .meanAbsoluteError(arm.getMeanAbsoluteError())
            .rootMeanSquaredError(arm.getRootMeanSquaredError())
            .recordedAt(now)
            .build();
    }

    private record Decision(AbTest test, boolean extended, String message) {
    }
}
