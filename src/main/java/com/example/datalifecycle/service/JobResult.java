package com.example.datalifecycle.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one job run, handed to the scheduler for logging and kept as the job's last result.
 * {@code details} is job specific (counts, cutoff, errors).
 */
@JsonInclude(Include.NON_NULL)
public record JobResult(boolean success, String message, Map<String, Object> details) {

    public JobResult {
        details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Result for a run that aborted before finishing its work.
     */
    public static JobResult failure(String message, Throwable error) {
        return new JobResult(false, message, Map.of("error", describe(error)));
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
