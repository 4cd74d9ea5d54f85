package com.example.datalifecycle.access;

import com.example.datalifecycle.models.AuditLogEntry;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the {@code audit_logs} table. Entries are written by the auditing
 * middleware; the lifecycle jobs only scrub or age them out.
 */
public interface AuditLogAccess {

    void save(AuditLogEntry entry);

    Optional<AuditLogEntry> findById(String id);

    /**
     * Clears user_id, ip_address and user_agent on every entry created strictly before the
     * cutoff that still carries at least one of them.
     *
     * @param cutoffTimestamp entries with created_at less than this are affected
     * @return number of entries that were changed
     */
    int clearIdentifiersOlderThan(long cutoffTimestamp);

    /**
     * Finds entries created strictly before the cutoff whose metadata attribute is present.
     */
    List<AuditLogEntry> findWithMetadataOlderThan(long cutoffTimestamp);

    void update(AuditLogEntry entry);

    /**
     * Nulls the user reference on every entry owned by the user. Entries themselves are kept.
     *
     * @return number of entries detached
     */
    int detachUser(String userId);

    /**
     * Permanently deletes entries created strictly before the cutoff.
     *
     * @return number of entries deleted
     */
    int deleteOlderThan(long cutoffTimestamp);
}
