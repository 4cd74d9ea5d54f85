package com.example.datalifecycle.access;

import com.example.datalifecycle.models.User;
import java.util.Optional;

public interface UserAccess {

    Optional<User> findById(String userId);

    User save(User user);

    /**
     * Writes every mapped attribute of the user. Attributes set to null are removed from the row.
     */
    User update(User user);

    /**
     * Permanently deletes the user row.
     */
    void delete(String userId);
}
