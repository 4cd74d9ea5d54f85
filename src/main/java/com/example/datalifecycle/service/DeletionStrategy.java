package com.example.datalifecycle.service;

/**
 * How a user's data is destroyed once their deletion request is finalized.
 */
public enum DeletionStrategy {
    /** Replace PII on the user row with placeholders; content rows stay, attributed to the sentinel name. */
    ANONYMIZE,
    /** Delete personal-data rows and the user row itself. */
    FULL_DELETE
}
