package com.example.datalifecycle.http;

import com.example.datalifecycle.service.ComplianceException;
import com.example.datalifecycle.service.JobResult;
import com.example.datalifecycle.service.JobScheduler;
import com.example.datalifecycle.service.JobScheduler.JobStatistics;
import com.example.datalifecycle.service.JobScheduler.JobStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of the lifecycle jobs: registration and last results, plus a manual trigger
 * for re-running a job outside its schedule.
 */
@RestController
public class JobController {

    private final JobScheduler jobScheduler;

    public JobController(JobScheduler jobScheduler) {
        this.jobScheduler = jobScheduler;
    }

    @GetMapping("/jobs")
    public ResponseEntity<JobStatistics> listJobs() {
        return ResponseEntity.ok(jobScheduler.getStatus());
    }

    @GetMapping("/jobs/{name}")
    public ResponseEntity<JobStatus> getJob(@PathVariable String name) {
        return jobScheduler.getJobStatus(name)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ComplianceException.jobNotFound(name));
    }

    @PostMapping("/jobs/{name}/run")
    public ResponseEntity<JobResult> runJob(@PathVariable String name) {
        return ResponseEntity.ok(jobScheduler.runNow(name));
    }
}
