package com.example.datalifecycle.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Duration;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

/**
 * A user's pending request to leave the platform. Created by the privacy API, finalized by
 * {@code DeletionFinalizationJob} once the grace period has elapsed.
 *
 * <p>Eligibility is always derived from {@code requestedAt}; {@code scheduledFor} is written by
 * the request API for display purposes and is not consulted here.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class DeletionRequest {

    public static final String STATUS_INDEX = "deletion_requests_by_status";

    @NonNull
    private String id;

    // null once the user row is gone
    private String userId;

    @NonNull
    private Long requestedAt;

    @NonNull
    @Default
    private Status status = Status.PENDING;

    private Long completedAt;
    private Long scheduledFor;
    private DeletionOptions options;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbSecondarySortKey(indexNames = STATUS_INDEX)
    @DynamoDbAttribute("requested_at")
    public Long getRequestedAt() { return requestedAt; }

    @DynamoDbSecondaryPartitionKey(indexNames = STATUS_INDEX)
    @DynamoDbAttribute("status")
    public Status getStatus() { return status; }

    @DynamoDbAttribute("completed_at")
    public Long getCompletedAt() { return completedAt; }

    @DynamoDbAttribute("scheduled_for")
    public Long getScheduledFor() { return scheduledFor; }

    @DynamoDbAttribute("options")
    public DeletionOptions getOptions() { return options; }

    // ----- Domain helpers -----

    /**
     * Earliest instant at which the request may be finalized.
     */
    public Instant eligibleAt(Duration gracePeriod) {
        return Instant.ofEpochMilli(requestedAt).plus(gracePeriod);
    }

    /**
     * True when the request is still pending and its grace period has elapsed at {@code now}.
     * Cancelled and completed requests are never eligible.
     */
    public boolean isEligible(Instant now, Duration gracePeriod) {
        return status == Status.PENDING && !now.isBefore(eligibleAt(gracePeriod));
    }

    public DeletionRequest markCompleted(long completedAtMillis) {
        this.status = Status.COMPLETED;
        this.completedAt = completedAtMillis;
        return this;
    }

    public enum Status {
        PENDING,
        CANCELLED,
        COMPLETED;

        @JsonCreator
        public static Status fromString(String v) {
            for (Status s : values()) {
                if (s.name().equals(v)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown DeletionRequest.Status: " + v);
        }
    }
}
