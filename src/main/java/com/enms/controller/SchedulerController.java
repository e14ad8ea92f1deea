package com.enms.controller;

import com.enms.dto.JobStatusResponse;
import com.enms.model.JobType;
import com.enms.scheduler.AnalyticsScheduler;
import com.enms.scheduler.DispatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Slf4j
public class SchedulerController {

    private final AnalyticsScheduler scheduler;

    @GetMapping("/scheduler")
    public ResponseEntity<List<JobStatusResponse>> status() {
        return ResponseEntity.ok(scheduler.getStatus());
    }

    /**
     * Run a job type now. Skipped when an invocation of the same type is still running.
     */
    @PostMapping("/scheduler/jobs/{jobType}/trigger")
    public ResponseEntity<TriggerResponse> trigger(@PathVariable JobType jobType) {
        DispatchResult result = scheduler.triggerJob(jobType);
        HttpStatus status = result == DispatchResult.SUBMITTED ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(new TriggerResponse(jobType, result));
    }

    record TriggerResponse(JobType jobType, DispatchResult result) {}
}
