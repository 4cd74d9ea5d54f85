package com.example.datalifecycle.service;

import com.example.datalifecycle.access.DeletionRequestAccess;
import com.example.datalifecycle.config.DeletionFinalizationProperties;
import com.example.datalifecycle.models.DeletionRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finalizes account deletions whose grace period has elapsed.
 *
 * <p>Eligible requests are PENDING with {@code requestedAt + gracePeriod <= now}. They are handed
 * to the {@link RecordProcessor} one at a time; a failing request is reported and stays PENDING
 * for the next run while the rest of the batch continues. Re-running with the same {@code now}
 * finds nothing left to do because completed requests drop out of the query.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeletionFinalizationJob implements ComplianceJob {

    public static final String NAME = "finalize-deletions";

    private final DeletionFinalizationProperties properties;
    private final DeletionRequestAccess deletionRequestAccess;
    private final RecordProcessor recordProcessor;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Execute scheduled user deletions past the " + properties.getGracePeriodDays() + "-day grace period";
    }

    @Override
    public String schedule() {
        return properties.getSchedule();
    }

    @Override
    public boolean enabled() {
        return properties.isEnabled();
    }

    @Override
    public JobResult run(Instant now) {
        Duration gracePeriod = Duration.ofDays(properties.getGracePeriodDays());
        try {
            long cutoffTimestamp = now.minus(gracePeriod).toEpochMilli();
            log.info("Starting finalization of scheduled deletions (grace period: {} days, cutoff: {})",
                    properties.getGracePeriodDays(), Instant.ofEpochMilli(cutoffTimestamp));

            List<DeletionRequest> candidates = deletionRequestAccess.findPendingRequestedAtOrBefore(cutoffTimestamp);
            log.debug("Found {} deletion requests to process", candidates.size());

            JobReport report = new JobReport()
                    .counter("totalRequests", candidates.size())
                    .counter("processedCount")
                    .counter("anonymizedCount")
                    .counter("deletedCount")
                    .attribute("gracePeriodDays", properties.getGracePeriodDays());

            for (DeletionRequest request : candidates) {
                // The index query already filters, but a request cancelled or completed since
                // the query ran must not be touched
                if (!request.isEligible(now, gracePeriod)) {
                    log.warn("Skipping deletion request {} - not eligible (status={}, requested_at={})",
                            request.getId(), request.getStatus(), request.getRequestedAt());
                    continue;
                }

                RecordOutcome outcome = recordProcessor.process(request, now);
                tally(report, outcome);
            }

            log.info("Deletion finalization completed: totalRequests={}, processed={}, anonymized={}, deleted={}, errors={}",
                    candidates.size(), report.count("processedCount"), report.count("anonymizedCount"),
                    report.count("deletedCount"), report.errors().size());

            return report.toResult(String.format("Processed %d deletion requests (%d anonymized, %d deleted)",
                    report.count("processedCount"), report.count("anonymizedCount"), report.count("deletedCount")));
        } catch (Exception ex) {
            log.error("Failed to finalize deletions: {}", ex.getMessage(), ex);
            return JobResult.failure("Failed to finalize deletions", ex);
        }
    }

    private static void tally(JobReport report, RecordOutcome outcome) {
        if (outcome.hasError()) {
            report.error(outcome.error());
            return;
        }
        if (!outcome.processed()) {
            return;
        }
        report.increment("processedCount");
        switch (outcome.mode()) {
            case ANONYMIZE -> report.increment("anonymizedCount");
            case FULL_DELETE -> report.increment("deletedCount");
            case NONE -> { }
        }
    }
}
