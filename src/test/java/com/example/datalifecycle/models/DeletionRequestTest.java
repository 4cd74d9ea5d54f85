package com.example.datalifecycle.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

class DeletionRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private static final Duration GRACE = Duration.ofDays(30);
    private static final Instant REQUESTED_AT = Instant.parse("2025-01-01T10:00:00Z");

    private static String readFixture(String path) throws IOException {
        try (InputStream in = DeletionRequestTest.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing test fixture: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static DeletionRequest pending() {
        return DeletionRequest.builder()
                .id("dr1")
                .userId("u1")
                .requestedAt(REQUESTED_AT.toEpochMilli())
                .build();
    }

    @Test
    @DisplayName("builder defaults status to PENDING")
    void defaultStatus() {
        assertEquals(DeletionRequest.Status.PENDING, pending().getStatus());
    }

    @Test
    @DisplayName("eligible exactly when the grace period has elapsed")
    void eligibilityBoundary() {
        DeletionRequest request = pending();
        Instant eligibleAt = REQUESTED_AT.plus(GRACE);

        assertEquals(eligibleAt, request.eligibleAt(GRACE));
        assertFalse(request.isEligible(eligibleAt.minusMillis(1), GRACE));
        assertTrue(request.isEligible(eligibleAt, GRACE));
        assertTrue(request.isEligible(eligibleAt.plusSeconds(1), GRACE));
    }

    @Test
    @DisplayName("cancelled and completed requests are never eligible")
    void terminalStatesNotEligible() {
        Instant later = REQUESTED_AT.plus(Duration.ofDays(365));

        DeletionRequest cancelled = pending().toBuilder().status(DeletionRequest.Status.CANCELLED).build();
        DeletionRequest completed = pending().markCompleted(later.toEpochMilli());

        assertFalse(cancelled.isEligible(later, GRACE));
        assertFalse(completed.isEligible(later, GRACE));
        assertEquals(DeletionRequest.Status.COMPLETED, completed.getStatus());
        assertEquals(later.toEpochMilli(), completed.getCompletedAt());
    }

    @Test
    @DisplayName("required fields are enforced by the builder")
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> DeletionRequest.builder().id("dr1").build());
        assertThrows(NullPointerException.class, () -> DeletionRequest.builder()
                .requestedAt(1L).build());
    }

    @Test
    @DisplayName("deserialize fixture into a request")
    void deserializeFixture() throws Exception {
        DeletionRequest request = MAPPER.readValue(readFixture("/fixtures/deletion_request.json"),
                DeletionRequest.class);

        assertEquals("dr_123", request.getId());
        assertEquals("user_42", request.getUserId());
        assertEquals(1735725600000L, request.getRequestedAt());
        assertEquals(DeletionRequest.Status.PENDING, request.getStatus());
        assertEquals(Boolean.FALSE, request.getOptions().getAnonymizeContributions());
        assertNull(request.getCompletedAt());
    }

    @Test
    @DisplayName("unknown status value is rejected")
    void unknownStatus() {
        assertThrows(IllegalArgumentException.class, () -> DeletionRequest.Status.fromString("EXPIRED"));
    }

    @Test
    @DisplayName("status index keys are mapped on the getters")
    void indexAnnotations() throws Exception {
        Method status = DeletionRequest.class.getMethod("getStatus");
        Method requestedAt = DeletionRequest.class.getMethod("getRequestedAt");

        assertEquals("status", status.getAnnotation(DynamoDbAttribute.class).value());
        assertEquals(DeletionRequest.STATUS_INDEX,
                status.getAnnotation(DynamoDbSecondaryPartitionKey.class).indexNames()[0]);
        assertEquals("requested_at", requestedAt.getAnnotation(DynamoDbAttribute.class).value());
        assertEquals(DeletionRequest.STATUS_INDEX,
                requestedAt.getAnnotation(DynamoDbSecondarySortKey.class).indexNames()[0]);
    }
}
