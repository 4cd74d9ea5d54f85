package com.example.datalifecycle.service;

/**
 * Individual store writes that make up one deletion request's cleanup.
 */
public enum CleanupStep {
    SCRUB_USER,
    DETACH_AUDIT_LOGS,
    DELETE_NOTIFICATIONS,
    DELETE_PUSH_TOKENS,
    DELETE_REFRESH_TOKENS,
    DELETE_CONSENT_RECORDS,
    DELETE_USER,
    COMPLETE_REQUEST
}
