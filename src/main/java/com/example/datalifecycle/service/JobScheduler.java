package com.example.datalifecycle.service;

import com.example.datalifecycle.config.SchedulerProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Registry and runner for every {@link ComplianceJob} bean.
 *
 * <p>When {@code compliance.scheduler.enabled} is set, each enabled job gets a cron trigger.
 * Whether triggered by cron or by {@link #runNow(String)}, a job never runs twice at the same
 * time, runs with {@code job} and {@code runId} in the MDC, and its result is kept for
 * {@link #getStatus()}. No exception from a job escapes a cron trigger.
 */
@Component
@Slf4j
public class JobScheduler implements SchedulingConfigurer {

    static final String MDC_JOB = "job";
    static final String MDC_RUN_ID = "runId";

    private final Map<String, ComplianceJob> jobs = new LinkedHashMap<>();
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();
    private final Map<String, Instant> lastRuns = new ConcurrentHashMap<>();
    private final Map<String, JobResult> lastResults = new ConcurrentHashMap<>();
    private final SchedulerProperties properties;
    private final Clock clock;

    public JobScheduler(List<ComplianceJob> jobs, SchedulerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        for (ComplianceJob job : jobs) {
            register(job);
        }
    }

    private void register(ComplianceJob job) {
        if (jobs.containsKey(job.name())) {
            throw ComplianceException.duplicateJob(job.name());
        }
        jobs.put(job.name(), job);
        log.info("Registered job: {} ({}), enabled={}", job.name(), job.schedule(), job.enabled());
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        if (!properties.isEnabled()) {
            log.info("Job scheduler disabled; {} jobs available for manual runs only", jobs.size());
            return;
        }

        ZoneId zone = ZoneId.of(properties.getZone());
        int scheduled = 0;
        for (ComplianceJob job : jobs.values()) {
            if (!job.enabled()) {
                log.debug("Skipping disabled job: {}", job.name());
                continue;
            }
            registrar.addCronTask(new CronTask(() -> runScheduled(job.name()),
                    new CronTrigger(job.schedule(), zone)));
            scheduled++;
            log.info("Scheduled job: {} ({} {})", job.name(), job.schedule(), zone);
        }
        log.info("Job scheduler started with {} active jobs", scheduled);
    }

    /**
     * Cron entry point. Overlapping ticks are skipped rather than queued.
     */
    void runScheduled(String jobName) {
        try {
            runNow(jobName);
        } catch (ComplianceException ex) {
            log.warn("Scheduled run of {} skipped: {}", jobName, ex.getMessage());
        }
    }

    /**
     * Runs a job immediately with the current time.
     *
     * @throws ComplianceException JOB_NOT_FOUND for an unknown name, JOB_ALREADY_RUNNING when a
     *                             previous run of the same job has not returned yet
     */
    public JobResult runNow(String jobName) {
        ComplianceJob job = jobs.get(jobName);
        if (job == null) {
            throw ComplianceException.jobNotFound(jobName);
        }
        return execute(job);
    }

    private JobResult execute(ComplianceJob job) {
        if (!runningJobs.add(job.name())) {
            throw ComplianceException.jobAlreadyRunning(job.name());
        }

        MDC.put(MDC_JOB, job.name());
        MDC.put(MDC_RUN_ID, "run-" + UUID.randomUUID());
        try {
            long startTime = clock.millis();
            Instant now = clock.instant();
            log.info("Starting job execution: {}", job.name());

            JobResult result;
            try {
                result = job.run(now);
            } catch (Exception ex) {
                // Jobs report their own failures; this only catches contract violations
                log.error("Job failed: {}", job.name(), ex);
                result = JobResult.failure(JobResult.describe(ex), ex);
            }

            long duration = clock.millis() - startTime;
            lastRuns.put(job.name(), now);
            lastResults.put(job.name(), result);
            if (result.success()) {
                log.info("Job completed successfully: {} in {}ms: {} {}",
                        job.name(), duration, result.message(), result.details());
            } else {
                log.warn("Job completed with errors: {} in {}ms: {} {}",
                        job.name(), duration, result.message(), result.details());
            }
            return result;
        } finally {
            runningJobs.remove(job.name());
            MDC.remove(MDC_JOB);
            MDC.remove(MDC_RUN_ID);
        }
    }

    public JobStatistics getStatus() {
        List<JobStatus> statuses = new ArrayList<>();
        for (ComplianceJob job : jobs.values()) {
            statuses.add(statusOf(job));
        }
        int enabled = (int) jobs.values().stream().filter(ComplianceJob::enabled).count();
        return new JobStatistics(jobs.size(), enabled, runningJobs.size(), Collections.unmodifiableList(statuses));
    }

    public Optional<JobStatus> getJobStatus(String jobName) {
        return Optional.ofNullable(jobs.get(jobName)).map(this::statusOf);
    }

    private JobStatus statusOf(ComplianceJob job) {
        return new JobStatus(
                job.name(),
                job.description(),
                job.enabled(),
                runningJobs.contains(job.name()),
                job.schedule(),
                lastRuns.get(job.name()),
                lastResults.get(job.name())
        );
    }

    public record JobStatus(
            String name,
            String description,
            boolean enabled,
            boolean running,
            String schedule,
            Instant lastRun,
            JobResult lastResult
    ) { }

    public record JobStatistics(
            int totalJobs,
            int enabledJobs,
            int runningJobs,
            List<JobStatus> jobs
    ) { }
}
