package com.enms.scheduler;

import com.enms.model.JobType;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one job invocation: how many machines were visited, how many
 * completed, and why the others were skipped (keyed by machine, valued by
 * error code or skip reason).
 */
@Getter
public class BatchReport {

    private final JobType jobType;
    private final Instant startedAt;
    private int processed;
    private int succeeded;
    private final Map<String, String> skipped = new LinkedHashMap<>();

    public BatchReport(JobType jobType, Instant startedAt) {
        this.jobType = jobType;
        this.startedAt = startedAt;
    }

    public void recordSuccess(String machineId) {
        processed++;
        succeeded++;
    }

    public void recordSkip(String machineId, String reason) {
        processed++;
        skipped.put(machineId, reason);
    }

    public String summary() {
        return String.format("%s: %d processed, %d succeeded, %d skipped %s",
            jobType, processed, succeeded, skipped.size(), skipped);
    }
}
