package com.enms.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last run bookkeeping per scheduler job type, kept so a restarted process
 * resumes on schedule instead of firing every job at once.
 */
@Entity
@Table(name = "scheduler_job_states")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerJobState {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private JobType jobType;

    private Instant lastStartedAt;

    private Instant lastFinishedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private JobOutcome lastOutcome;

    @Column(length = 1000)
    private String lastMessage;
}
