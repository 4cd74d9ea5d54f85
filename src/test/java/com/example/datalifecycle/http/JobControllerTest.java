package com.example.datalifecycle.http;

import static org.hamcrest.Matchers.equalTo;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.datalifecycle.service.ComplianceException;
import com.example.datalifecycle.service.JobResult;
import com.example.datalifecycle.service.JobScheduler;
import com.example.datalifecycle.service.JobScheduler.JobStatistics;
import com.example.datalifecycle.service.JobScheduler.JobStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = JobController.class)
class JobControllerTest {

    private static final Instant LAST_RUN = Instant.parse("2025-03-01T04:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobScheduler jobScheduler;

    @Test
    @DisplayName("GET /jobs lists registered jobs in snake_case")
    void listJobs() throws Exception {
        JobResult last = new JobResult(true, "Processed 1 deletion requests (1 anonymized, 0 deleted)",
                Map.of("processedCount", 1));
        when(jobScheduler.getStatus()).thenReturn(new JobStatistics(1, 1, 0, List.of(
                new JobStatus("finalize-deletions", "Execute scheduled user deletions", true, false,
                        "0 30 4 * * *", LAST_RUN, last))));

        mockMvc.perform(MockMvcRequestBuilders.get("/jobs"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.total_jobs", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.enabled_jobs", equalTo(1)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.running_jobs", equalTo(0)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.jobs[0].name", equalTo("finalize-deletions")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.jobs[0].last_run", equalTo("2025-03-01T04:30:00Z")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.jobs[0].last_result.success", equalTo(true)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.jobs[0].last_result.details.processedCount", equalTo(1)));
    }

    @Test
    @DisplayName("GET /jobs/{name} returns 404 for an unknown job")
    void getUnknownJob() throws Exception {
        when(jobScheduler.getJobStatus("nope")).thenReturn(Optional.empty());

        mockMvc.perform(MockMvcRequestBuilders.get("/jobs/nope"))
                .andExpect(MockMvcResultMatchers.status().isNotFound())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("JOB_NOT_FOUND")));
    }

    @Test
    @DisplayName("POST /jobs/{name}/run returns the run result")
    void runJob() throws Exception {
        when(jobScheduler.runNow("delete-audit-logs")).thenReturn(new JobResult(true,
                "Deleted 4 audit logs older than 3 years", Map.of("deletedCount", 4, "retentionYears", 3)));

        mockMvc.perform(MockMvcRequestBuilders.post("/jobs/delete-audit-logs/run"))
                .andExpect(MockMvcResultMatchers.status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.success", equalTo(true)))
                .andExpect(MockMvcResultMatchers.jsonPath("$.message", equalTo("Deleted 4 audit logs older than 3 years")))
                .andExpect(MockMvcResultMatchers.jsonPath("$.details.deletedCount", equalTo(4)));

        verify(jobScheduler).runNow("delete-audit-logs");
    }

    @Test
    @DisplayName("POST /jobs/{name}/run returns 409 while the job is running")
    void runJobConflict() throws Exception {
        when(jobScheduler.runNow("finalize-deletions"))
                .thenThrow(ComplianceException.jobAlreadyRunning("finalize-deletions"));

        mockMvc.perform(MockMvcRequestBuilders.post("/jobs/finalize-deletions/run"))
                .andExpect(MockMvcResultMatchers.status().isConflict())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("JOB_ALREADY_RUNNING")));
    }

    @Test
    @DisplayName("unexpected errors map to 500")
    void unexpectedError() throws Exception {
        when(jobScheduler.getStatus()).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(MockMvcRequestBuilders.get("/jobs"))
                .andExpect(MockMvcResultMatchers.status().isInternalServerError())
                .andExpect(MockMvcResultMatchers.jsonPath("$.code", equalTo("INTERNAL_ERROR")));
    }
}
