package com.example.datalifecycle.service;

import java.time.Instant;

/**
 * A batch that runs to completion once per scheduled tick. Implementations must not throw from
 * {@link #run(Instant)}: run-level failures are reported through {@link JobResult#success()}.
 */
public interface ComplianceJob {

    /**
     * Unique job name; also used as the {@code job} MDC tag while the job runs.
     */
    String name();

    String description();

    /**
     * Six-field Spring cron expression, evaluated in UTC.
     */
    String schedule();

    boolean enabled();

    JobResult run(Instant now);
}
