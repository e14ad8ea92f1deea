package com.enms.scheduler;

import com.enms.model.JobType;

import java.time.Duration;

/**
 * A periodic batch over the machine fleet. Implementations handle per-machine
 * failures themselves and report them in the returned {@link BatchReport};
 * an exception escaping {@link #run()} marks the whole invocation failed.
 */
public interface ScheduledJob {

    JobType type();

    Duration interval();

    BatchReport run();
}
