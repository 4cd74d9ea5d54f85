package com.example.datalifecycle.access;

import com.example.datalifecycle.models.DeletionRequest;
import java.util.List;
import java.util.Optional;

public interface DeletionRequestAccess {

    Optional<DeletionRequest> findById(String requestId);

    /**
     * Finds PENDING requests whose requested_at is at or before the cutoff, using the
     * deletion_requests_by_status GSI. Cancelled and completed requests never match.
     *
     * @param cutoffTimestamp latest requested_at (epoch millis, inclusive) to return
     * @return pending requests ordered by requested_at ascending
     */
    List<DeletionRequest> findPendingRequestedAtOrBefore(long cutoffTimestamp);

    DeletionRequest save(DeletionRequest request);

    /**
     * Writes the completed request only while the stored row is still PENDING.
     *
     * @return false when the stored request was cancelled or completed in the meantime
     */
    boolean completeIfPending(DeletionRequest completed);
}
