package com.example.datalifecycle.service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of processing one deletion request. Cleanup is not atomic, so the outcome lists every
 * step that was attempted; a failed outcome may still carry succeeded steps whose effects are
 * already in the store.
 *
 * @param processed true when the request reached COMPLETED during this call
 * @param mode      strategy that was applied, or {@link Mode#NONE} when the user was already gone
 * @param error     record-level error, null on success
 * @param steps     attempted steps in completion order
 */
public record RecordOutcome(boolean processed, Mode mode, String error, List<StepResult> steps) {

    public enum Mode {
        ANONYMIZE,
        FULL_DELETE,
        NONE;

        static Mode of(DeletionStrategy strategy) {
            return switch (strategy) {
                case ANONYMIZE -> ANONYMIZE;
                case FULL_DELETE -> FULL_DELETE;
            };
        }
    }

    public RecordOutcome {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static RecordOutcome completed(Mode mode, List<StepResult> steps) {
        return new RecordOutcome(true, mode, null, steps);
    }

    public static RecordOutcome failed(Mode mode, String error, List<StepResult> steps) {
        return new RecordOutcome(false, mode, error, steps);
    }

    /**
     * Outcome for a request that was not in a processable state; nothing was written.
     */
    public static RecordOutcome skipped() {
        return skipped(Mode.NONE, List.of());
    }

    /**
     * Outcome for a request that stopped being PENDING while its cleanup ran. The steps already
     * applied stay in the store and the request keeps the status it was moved to.
     */
    public static RecordOutcome skipped(Mode mode, List<StepResult> steps) {
        return new RecordOutcome(false, mode, null, steps);
    }

    public boolean hasError() {
        return error != null;
    }

    public List<CleanupStep> succeededSteps() {
        return steps.stream()
                .filter(StepResult::succeeded)
                .map(StepResult::step)
                .collect(Collectors.toList());
    }

    public Optional<StepResult> step(CleanupStep step) {
        return steps.stream().filter(s -> s.step() == step).findFirst();
    }

    /**
     * @param affected rows touched by the step, zero when it failed
     * @param error    failure message, null when the step succeeded
     */
    public record StepResult(CleanupStep step, boolean succeeded, int affected, String error) {

        public static StepResult success(CleanupStep step, int affected) {
            return new StepResult(step, true, affected, null);
        }

        public static StepResult failure(CleanupStep step, String error) {
            return new StepResult(step, false, 0, error);
        }
    }
}
