package com.example.datalifecycle.service;

import com.example.datalifecycle.access.AuditLogAccess;
import com.example.datalifecycle.config.AuditPurgeProperties;
import java.time.Instant;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Permanently deletes audit log entries past the hard retention limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogPurgeJob implements ComplianceJob {

    public static final String NAME = "delete-audit-logs";

    private final AuditPurgeProperties properties;
    private final AuditLogAccess auditLogAccess;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Delete audit logs older than " + properties.getRetentionYears() + " years";
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
        try {
            Instant cutoff = now.atZone(ZoneOffset.UTC).minusYears(properties.getRetentionYears()).toInstant();
            log.info("Starting deletion of audit logs older than {}", cutoff);

            int deletedCount = auditLogAccess.deleteOlderThan(cutoff.toEpochMilli());

            log.info("Deletion completed: deletedCount={}, cutoffDate={}", deletedCount, cutoff);

            return new JobReport()
                    .counter("deletedCount", deletedCount)
                    .attribute("cutoffDate", cutoff.toString())
                    .attribute("retentionYears", properties.getRetentionYears())
                    .toResult(String.format("Deleted %d audit logs older than %d years",
                            deletedCount, properties.getRetentionYears()));
        } catch (Exception ex) {
            log.error("Failed to delete old audit logs: {}", ex.getMessage(), ex);
            return JobResult.failure("Failed to delete old audit logs", ex);
        }
    }
}
