package com.example.datalifecycle.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import com.example.datalifecycle.access.AuditLogAccess;
import com.example.datalifecycle.config.AuditAnonymizationProperties;
import com.example.datalifecycle.models.AuditLogEntry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuditLogAnonymizationJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T03:00:00Z"), ZoneOffset.UTC);
    private static final Instant NOW = CLOCK.instant();
    private static final Instant CUTOFF = Instant.parse("2024-03-01T03:00:00Z");

    private AuditAnonymizationProperties properties;
    private InMemoryAuditLogAccess auditLogs;
    private AuditLogAnonymizationJob job;

    @BeforeEach
    void setUp() {
        properties = new AuditAnonymizationProperties();
        properties.setRetentionYears(1);
        auditLogs = new InMemoryAuditLogAccess();
        job = new AuditLogAnonymizationJob(properties, auditLogs, PiiScrubPolicy.defaults());
    }

    @Test
    @DisplayName("cutoff is one calendar year before now in UTC")
    void cutoffIsCalendarYear() {
        assertEquals(CUTOFF, job.cutoff(NOW));
        assertEquals(Instant.parse("2023-02-28T12:00:00Z"), job.cutoff(Instant.parse("2024-02-29T12:00:00Z")));
    }

    @Test
    @DisplayName("clears identifiers on aged entries and leaves recent ones alone")
    void clearsAgedIdentifiers() {
        auditLogs.save(entry("old", CUTOFF.minusSeconds(3600), "u1", "10.0.0.1", "curl/8", null));
        auditLogs.save(entry("recent", NOW.minusSeconds(3600), "u1", "10.0.0.2", "curl/8", null));

        JobResult result = job.run(NOW);

        assertTrue(result.success());
        assertEquals(1, result.details().get("anonymizedCount"));
        assertEquals(0, result.details().get("metadataAnonymized"));
        assertEquals(CUTOFF.toString(), result.details().get("cutoffDate"));
        assertEquals(1, result.details().get("retentionYears"));
        assertEquals("Anonymized 1 audit logs, sanitized metadata in 0 logs", result.message());

        AuditLogEntry old = auditLogs.findById("old").orElseThrow();
        assertNull(old.getUserId());
        assertNull(old.getIpAddress());
        assertNull(old.getUserAgent());
        assertEquals("LOGIN", old.getAction());

        AuditLogEntry recent = auditLogs.findById("recent").orElseThrow();
        assertEquals("u1", recent.getUserId());
        assertEquals("10.0.0.2", recent.getIpAddress());
    }

    @Test
    @DisplayName("entry exactly at the cutoff is kept; one millisecond older is swept")
    void retentionBoundary() {
        auditLogs.save(entry("at", CUTOFF, "u1", "10.0.0.1", null, Map.of("email", "a@b.c")));
        auditLogs.save(entry("before", CUTOFF.minusMillis(1), "u1", "10.0.0.1", null, Map.of("email", "a@b.c")));

        JobResult result = job.run(NOW);

        assertEquals(1, result.details().get("anonymizedCount"));
        assertEquals(1, result.details().get("metadataAnonymized"));
        assertEquals("u1", auditLogs.findById("at").orElseThrow().getUserId());
        assertEquals(Map.of("email", "a@b.c"), auditLogs.findById("at").orElseThrow().getMetadata());
        assertNull(auditLogs.findById("before").orElseThrow().getUserId());
        assertEquals(Map.of(), auditLogs.findById("before").orElseThrow().getMetadata());
    }

    @Test
    @DisplayName("entry whose only identifier is an IP address is still anonymized")
    void detachedEntryWithAddress() {
        auditLogs.save(entry("detached", CUTOFF.minusSeconds(60), null, "10.0.0.9", null, null));
        auditLogs.save(entry("clean", CUTOFF.minusSeconds(60), null, null, null, null));

        JobResult result = job.run(NOW);

        assertEquals(1, result.details().get("anonymizedCount"));
        assertNull(auditLogs.findById("detached").orElseThrow().getIpAddress());
    }

    @Test
    @DisplayName("removes only the PII keys from metadata")
    void scrubsMetadata() {
        auditLogs.save(entry("pii", CUTOFF.minusSeconds(60), null, null, null,
                Map.of("email", "x@y.z", "name", "X", "phoneNumber", "555", "address", "Main St", "action", "export")));
        auditLogs.save(entry("nopii", CUTOFF.minusSeconds(60), null, null, null, Map.of("action", "export")));

        JobResult result = job.run(NOW);

        assertEquals(1, result.details().get("metadataAnonymized"));
        assertEquals(Map.of("action", "export"), auditLogs.findById("pii").orElseThrow().getMetadata());
        assertEquals(Map.of("action", "export"), auditLogs.findById("nopii").orElseThrow().getMetadata());
    }

    @Test
    @DisplayName("second run over the same data reports zero for both phases")
    void idempotentRerun() {
        auditLogs.save(entry("a", CUTOFF.minusSeconds(60), "u1", "10.0.0.1", "ua", Map.of("email", "a@b.c", "k", 1)));
        auditLogs.save(entry("b", CUTOFF.minusSeconds(120), "u2", null, null, Map.of("name", "B")));

        JobResult first = job.run(NOW);
        JobResult second = job.run(NOW);

        assertEquals(2, first.details().get("anonymizedCount"));
        assertEquals(2, first.details().get("metadataAnonymized"));
        assertTrue(second.success());
        assertEquals(0, second.details().get("anonymizedCount"));
        assertEquals(0, second.details().get("metadataAnonymized"));
        assertEquals(Map.of("k", 1), auditLogs.findById("a").orElseThrow().getMetadata());
    }

    @Test
    @DisplayName("failure on one entry's metadata is recorded and the others are still scrubbed")
    void perEntryFailure() {
        InMemoryAuditLogAccess spied = spy(auditLogs);
        lenient().doThrow(new IllegalStateException("item too large"))
                .when(spied).update(argThat(e -> "bad".equals(e.getId())));
        job = new AuditLogAnonymizationJob(properties, spied, PiiScrubPolicy.defaults());

        auditLogs.save(entry("bad", CUTOFF.minusSeconds(60), null, null, null, Map.of("email", "a@b.c")));
        auditLogs.save(entry("good", CUTOFF.minusSeconds(60), null, null, null, Map.of("email", "d@e.f")));

        JobResult result = job.run(NOW);

        assertFalse(result.success());
        assertEquals(1, result.details().get("metadataAnonymized"));
        @SuppressWarnings("unchecked")
        List<String> errors = (List<String>) result.details().get("errors");
        assertEquals(List.of("Failed to sanitize metadata for audit log bad: item too large"), errors);
        assertEquals(Map.of(), auditLogs.findById("good").orElseThrow().getMetadata());
        assertEquals(Map.of("email", "a@b.c"), auditLogs.findById("bad").orElseThrow().getMetadata());
    }

    @Test
    @DisplayName("store failure aborts the run with a failure result")
    void runLevelFailure() {
        AuditLogAccess failing = mock(AuditLogAccess.class);
        when(failing.clearIdentifiersOlderThan(anyLong())).thenThrow(new IllegalStateException("scan denied"));

        JobResult result = new AuditLogAnonymizationJob(properties, failing, PiiScrubPolicy.defaults()).run(NOW);

        assertFalse(result.success());
        assertEquals("Failed to anonymize audit logs", result.message());
        assertEquals(Map.of("error", "scan denied"), result.details());
    }

    private static AuditLogEntry entry(String id, Instant createdAt, String userId, String ip, String userAgent,
                                       Map<String, Object> metadata) {
        return AuditLogEntry.builder()
                .id(id)
                .action("LOGIN")
                .createdAt(createdAt.toEpochMilli())
                .userId(userId)
                .ipAddress(ip)
                .userAgent(userAgent)
                .metadata(metadata)
                .build();
    }
}
