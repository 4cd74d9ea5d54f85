package com.example.datalifecycle.access;

import com.example.datalifecycle.models.PushToken;

public interface PushTokenAccess extends UserLinkedDataAccess<PushToken> {

    /**
     * Deletes tokens whose last_used_at is strictly before the cutoff.
     *
     * @return number of tokens deleted
     */
    int deleteLastUsedBefore(long cutoffTimestamp);
}
