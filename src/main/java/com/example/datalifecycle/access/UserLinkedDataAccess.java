package com.example.datalifecycle.access;

import com.example.datalifecycle.models.UserLinked;
import java.util.List;

/**
 * Common contract for the personal-data tables that hang off a user (push tokens, refresh
 * tokens, consent records, notifications). Rows are located through the {@code by_user_id} index.
 *
 * @param <T> row type
 */
public interface UserLinkedDataAccess<T extends UserLinked> {

    T save(T item);

    List<T> findByUserId(String userId);

    /**
     * Deletes every row linked to the user.
     *
     * @return number of rows deleted
     */
    int deleteByUserId(String userId);
}
