package com.example.datalifecycle.models;

/**
 * Row in one of the personal-data tables keyed by its own id and linked to a user through
 * the {@code by_user_id} index.
 */
public interface UserLinked {

    String BY_USER_ID_INDEX = "by_user_id";

    String getId();

    String getUserId();
}
