package com.example.datalifecycle.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.datalifecycle.models.DeletionOptions;
import com.example.datalifecycle.models.User;
import com.example.datalifecycle.service.PiiScrubPolicy.MetadataScrub;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PiiScrubPolicyTest {

    private static final Instant NOW = Instant.parse("2025-03-01T04:30:00Z");

    private final PiiScrubPolicy policy = PiiScrubPolicy.defaults();

    @Test
    @DisplayName("only an explicit false selects full delete")
    void strategySelection() {
        assertEquals(DeletionStrategy.ANONYMIZE, policy.selectStrategy(null));
        assertEquals(DeletionStrategy.ANONYMIZE, policy.selectStrategy(new DeletionOptions()));
        assertEquals(DeletionStrategy.ANONYMIZE, policy.selectStrategy(new DeletionOptions(true)));
        assertEquals(DeletionStrategy.FULL_DELETE, policy.selectStrategy(new DeletionOptions(false)));
    }

    @Test
    @DisplayName("anonymized copy has placeholders and the input is unchanged")
    void anonymizeUser() {
        User user = User.builder()
                .id("u-42")
                .email("jane@example.com")
                .name("Jane")
                .bio("hello")
                .avatarUrl("https://cdn/x.png")
                .createdAt(1L)
                .showEmailOnProfile(true)
                .includeInSearch(true)
                .showActivityPublicly(true)
                .build();

        User scrubbed = policy.anonymize(user, NOW);

        assertEquals("u-42", scrubbed.getId());
        assertEquals("deleted-u-42@deleted.local", scrubbed.getEmail());
        assertEquals(PiiScrubPolicy.SENTINEL_NAME, scrubbed.getName());
        assertNull(scrubbed.getBio());
        assertNull(scrubbed.getAvatarUrl());
        assertEquals(1L, scrubbed.getCreatedAt());
        assertEquals(NOW.toEpochMilli(), scrubbed.getAnonymizedAt());
        assertEquals(NOW.toEpochMilli(), scrubbed.getDeletedAt());
        assertFalse(scrubbed.getShowEmailOnProfile());
        assertFalse(scrubbed.getIncludeInSearch());
        assertFalse(scrubbed.getShowActivityPublicly());

        assertEquals("jane@example.com", user.getEmail());
        assertEquals("hello", user.getBio());
    }

    @Test
    @DisplayName("placeholder emails are unique per user")
    void placeholderEmailUnique() {
        assertFalse(PiiScrubPolicy.placeholderEmail("a").equals(PiiScrubPolicy.placeholderEmail("b")));
    }

    @Test
    @DisplayName("metadata scrub removes top-level PII keys only")
    void scrubMetadata() {
        Map<String, Object> metadata = Map.of(
                "email", "x@y.z",
                "phoneNumber", "555",
                "action", "export",
                "nested", Map.of("email", "inner@y.z"));

        MetadataScrub scrub = policy.scrubMetadata(metadata);

        assertTrue(scrub.changed());
        assertEquals(Set.of("email", "phoneNumber"), scrub.removedKeys());
        assertEquals(Map.of("action", "export", "nested", Map.of("email", "inner@y.z")), scrub.sanitized());
        assertEquals(4, metadata.size());
    }

    @Test
    @DisplayName("metadata without PII keys is reported as unchanged")
    void scrubMetadataUnchanged() {
        MetadataScrub scrub = policy.scrubMetadata(Map.of("action", "login"));

        assertFalse(scrub.changed());
        assertEquals(Map.of("action", "login"), scrub.sanitized());
        assertFalse(policy.scrubMetadata(null).changed());
    }

    @Test
    @DisplayName("configured key list replaces the defaults")
    void customKeys() {
        PiiScrubPolicy custom = new PiiScrubPolicy(List.of("ssn"));

        MetadataScrub scrub = custom.scrubMetadata(Map.of("ssn", "123", "email", "x@y.z"));

        assertEquals(Map.of("email", "x@y.z"), scrub.sanitized());
    }
}
