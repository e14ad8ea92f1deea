package com.enms.dto;

import com.enms.model.JobOutcome;
import com.enms.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private JobType jobType;
    private Duration interval;
    private boolean running;
    private Instant lastStartedAt;
    private Instant lastFinishedAt;
    private JobOutcome lastOutcome;
    private String lastMessage;
}
