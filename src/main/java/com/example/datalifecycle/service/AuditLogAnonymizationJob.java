package com.example.datalifecycle.service;

import com.example.datalifecycle.access.AuditLogAccess;
import com.example.datalifecycle.config.AuditAnonymizationProperties;
import com.example.datalifecycle.models.AuditLogEntry;
import com.example.datalifecycle.service.PiiScrubPolicy.MetadataScrub;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Anonymizes audit log entries older than the retention window, in two phases:
 * <ol>
 *   <li>bulk clear of user_id, ip_address and user_agent on every aged entry that still has one;</li>
 *   <li>per-entry removal of PII keys from the metadata bag, written back only when a key was removed.</li>
 * </ol>
 * Both phases select only entries that still need work, so a re-run after a partial failure
 * reports zero for whatever was already scrubbed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogAnonymizationJob implements ComplianceJob {

    public static final String NAME = "anonymize-audit-logs";

    private final AuditAnonymizationProperties properties;
    private final AuditLogAccess auditLogAccess;
    private final PiiScrubPolicy scrubPolicy;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Anonymize audit logs older than " + properties.getRetentionYears() + " year(s)";
    }

    @Override
    public String schedule() {
        return properties.getSchedule();
    }

    @Override
    public boolean enabled() {
        return properties.isEnabled();
    }

    /**
     * Entries created strictly before the returned instant are past retention.
     */
    public Instant cutoff(Instant now) {
        return now.atZone(ZoneOffset.UTC).minusYears(properties.getRetentionYears()).toInstant();
    }

    @Override
    public JobResult run(Instant now) {
        try {
            Instant cutoff = cutoff(now);
            long cutoffTimestamp = cutoff.toEpochMilli();
            log.info("Starting anonymization of audit logs older than {}", cutoff);

            int anonymizedCount = auditLogAccess.clearIdentifiersOlderThan(cutoffTimestamp);
            log.debug("Cleared identifiers on {} audit logs", anonymizedCount);

            List<AuditLogEntry> withMetadata = auditLogAccess.findWithMetadataOlderThan(cutoffTimestamp);
            log.debug("Found {} aged audit logs with metadata", withMetadata.size());

            JobReport report = new JobReport()
                    .counter("anonymizedCount", anonymizedCount)
                    .counter("metadataAnonymized")
                    .attribute("cutoffDate", cutoff.toString())
                    .attribute("retentionYears", properties.getRetentionYears());

            for (AuditLogEntry entry : withMetadata) {
                try {
                    MetadataScrub scrub = scrubPolicy.scrubMetadata(entry.getMetadata());
                    if (!scrub.changed()) {
                        continue;
                    }
                    auditLogAccess.update(entry.toBuilder().metadata(scrub.sanitized()).build());
                    report.increment("metadataAnonymized");
                    log.debug("Removed {} from metadata of audit log {}", scrub.removedKeys(), entry.getId());
                } catch (Exception ex) {
                    String error = "Failed to sanitize metadata for audit log " + entry.getId() + ": "
                            + JobResult.describe(ex);
                    log.error(error, ex);
                    report.error(error);
                }
            }

            log.info("Anonymization completed: anonymizedCount={}, metadataAnonymized={}, cutoffDate={}, errors={}",
                    anonymizedCount, report.count("metadataAnonymized"), cutoff, report.errors().size());

            return report.toResult(String.format("Anonymized %d audit logs, sanitized metadata in %d logs",
                    anonymizedCount, report.count("metadataAnonymized")));
        } catch (Exception ex) {
            log.error("Failed to anonymize audit logs: {}", ex.getMessage(), ex);
            return JobResult.failure("Failed to anonymize audit logs", ex);
        }
    }
}
