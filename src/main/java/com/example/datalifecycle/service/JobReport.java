package com.example.datalifecycle.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run accumulator of counts, fixed attributes and record-level errors. A job creates one
 * at the start of {@code run} and folds every record outcome into it, so nothing is shared
 * between runs.
 *
 * <p>Counters are reported first, in registration order, followed by attributes and finally
 * {@code errors} when there are any.
 */
public final class JobReport {

    private final Map<String, Integer> counters = new LinkedHashMap<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    public JobReport counter(String name, int initialValue) {
        counters.put(name, initialValue);
        return this;
    }

    public JobReport counter(String name) {
        return counter(name, 0);
    }

    public JobReport increment(String name) {
        counters.merge(name, 1, Integer::sum);
        return this;
    }

    public JobReport attribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }

    public JobReport error(String message) {
        errors.add(message);
        return this;
    }

    public int count(String name) {
        return counters.getOrDefault(name, 0);
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    /**
     * Builds the result; the run counts as successful only when no record-level error was recorded.
     */
    public JobResult toResult(String message) {
        Map<String, Object> details = new LinkedHashMap<>(counters);
        details.putAll(attributes);
        if (!errors.isEmpty()) {
            details.put("errors", List.copyOf(errors));
        }
        return new JobResult(errors.isEmpty(), message, details);
    }
}
