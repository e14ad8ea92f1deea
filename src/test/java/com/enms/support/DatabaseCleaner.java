package com.enms.support;

import com.enms.repository.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Empties every table between integration tests. Uses entity deletes so
 * element-collection rows go with their owners.
 */
@Component
@RequiredArgsConstructor
public class DatabaseCleaner {

    private final AbTestRepository abTestRepository;
    private final ActiveModelPointerRepository pointerRepository;
    private final AlertRepository alertRepository;
    private final AnomalyRepository anomalyRepository;
    private final BaselineModelRepository modelRepository;
    private final DriftEventRepository driftEventRepository;
    private final EnergyReadingRepository readingRepository;
    private final MachineRepository machineRepository;
    private final PerformanceMetricRepository metricRepository;
    private final RetrainJobRepository jobRepository;
    private final SchedulerJobStateRepository schedulerStateRepository;

    public void clean() {
        abTestRepository.deleteAll();
        pointerRepository.deleteAll();
        alertRepository.deleteAll();
        anomalyRepository.deleteAll();
        driftEventRepository.deleteAll();
        metricRepository.deleteAll();
        jobRepository.deleteAll();
        modelRepository.deleteAll();
        readingRepository.deleteAll();
        machineRepository.deleteAll();
        schedulerStateRepository.deleteAll();
    }
}
