package com.example.datalifecycle.health;

import com.example.datalifecycle.config.SchedulerProperties;
import com.example.datalifecycle.service.JobScheduler;
import com.example.datalifecycle.service.JobScheduler.JobStatistics;
import java.time.Clock;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness plus a glance at the job registry: whether cron registration is on and how many
 * jobs are enabled or running right now.
 */
@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final String env;
    private final Clock clock;
    private final JobScheduler jobScheduler;
    private final SchedulerProperties schedulerProperties;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            Clock clock,
                            JobScheduler jobScheduler,
                            SchedulerProperties schedulerProperties) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.clock = clock;
        this.jobScheduler = jobScheduler;
        this.schedulerProperties = schedulerProperties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        JobStatistics jobs = jobScheduler.getStatus();
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", clock.instant().toString(),
                "env", env,
                "app", buildProperties != null ? buildProperties.getName() : "data-lifecycle",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev",
                "scheduler", schedulerProperties.isEnabled() ? "enabled" : "disabled",
                "enabled_jobs", jobs.enabledJobs(),
                "running_jobs", jobs.runningJobs()
        ));
    }
}
