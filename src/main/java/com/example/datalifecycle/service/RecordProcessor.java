package com.example.datalifecycle.service;

import com.example.datalifecycle.access.AuditLogAccess;
import com.example.datalifecycle.access.ConsentRecordAccess;
import com.example.datalifecycle.access.DeletionRequestAccess;
import com.example.datalifecycle.access.NotificationAccess;
import com.example.datalifecycle.access.PushTokenAccess;
import com.example.datalifecycle.access.RefreshTokenAccess;
import com.example.datalifecycle.access.UserAccess;
import com.example.datalifecycle.models.DeletionRequest;
import com.example.datalifecycle.models.User;
import com.example.datalifecycle.service.RecordOutcome.Mode;
import com.example.datalifecycle.service.RecordOutcome.StepResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Finalizes a single deletion request against the store. Knows nothing about batching; the
 * caller always gets a {@link RecordOutcome} back, never an exception.
 *
 * <p>Within one request the writes to disjoint personal-data tables are issued concurrently on
 * the cleanup executor and joined before the request is marked COMPLETED. There is no
 * transaction: a failed step leaves the steps that already succeeded in place and the request
 * stays PENDING, so the next run picks it up again.
 */
@Service
@Slf4j
public class RecordProcessor {

    private final PiiScrubPolicy scrubPolicy;
    private final UserAccess userAccess;
    private final DeletionRequestAccess deletionRequestAccess;
    private final AuditLogAccess auditLogAccess;
    private final PushTokenAccess pushTokenAccess;
    private final RefreshTokenAccess refreshTokenAccess;
    private final ConsentRecordAccess consentRecordAccess;
    private final NotificationAccess notificationAccess;
    private final Executor cleanupExecutor;

    public RecordProcessor(PiiScrubPolicy scrubPolicy,
                           UserAccess userAccess,
                           DeletionRequestAccess deletionRequestAccess,
                           AuditLogAccess auditLogAccess,
                           PushTokenAccess pushTokenAccess,
                           RefreshTokenAccess refreshTokenAccess,
                           ConsentRecordAccess consentRecordAccess,
                           NotificationAccess notificationAccess,
                           @Qualifier("cleanupExecutor") Executor cleanupExecutor) {
        this.scrubPolicy = scrubPolicy;
        this.userAccess = userAccess;
        this.deletionRequestAccess = deletionRequestAccess;
        this.auditLogAccess = auditLogAccess;
        this.pushTokenAccess = pushTokenAccess;
        this.refreshTokenAccess = refreshTokenAccess;
        this.consentRecordAccess = consentRecordAccess;
        this.notificationAccess = notificationAccess;
        this.cleanupExecutor = cleanupExecutor;
    }

    public RecordOutcome process(DeletionRequest snapshot, Instant now) {
        List<StepResult> steps = new ArrayList<>();
        Mode mode = Mode.NONE;
        try {
            // The batch hands over the row it queried; a cancellation since then wins
            Optional<DeletionRequest> current = deletionRequestAccess.findById(snapshot.getId());
            if (current.isEmpty() || current.get().getStatus() != DeletionRequest.Status.PENDING) {
                log.warn("Skipping deletion request {} in status {}", snapshot.getId(),
                        current.map(DeletionRequest::getStatus).orElse(null));
                return RecordOutcome.skipped();
            }
            DeletionRequest request = current.get();

            Optional<User> user = request.getUserId() == null
                    ? Optional.empty()
                    : userAccess.findById(request.getUserId());

            if (user.isEmpty()) {
                // Removed out of band; there is nothing left to scrub
                log.info("User {} for deletion request {} no longer exists, marking completed",
                        request.getUserId(), request.getId());
                return complete(request, Mode.NONE, steps, now);
            }

            DeletionStrategy strategy = scrubPolicy.selectStrategy(request.getOptions());
            mode = Mode.of(strategy);
            steps.addAll(switch (strategy) {
                case ANONYMIZE -> anonymize(user.get(), now);
                case FULL_DELETE -> fullDelete(user.get());
            });

            List<StepResult> failures = steps.stream()
                    .filter(s -> !s.succeeded())
                    .collect(Collectors.toList());
            if (!failures.isEmpty()) {
                String error = failureMessage(request, failures.stream()
                        .map(s -> s.step() + ": " + s.error())
                        .collect(Collectors.joining("; ")));
                log.error(error);
                return RecordOutcome.failed(mode, error, steps);
            }

            return complete(request, mode, steps, now);
        } catch (Exception ex) {
            String error = failureMessage(snapshot, JobResult.describe(ex));
            log.error(error, ex);
            return RecordOutcome.failed(mode, error, steps);
        }
    }

    private List<StepResult> anonymize(User user, Instant now) {
        String userId = user.getId();
        log.info("Anonymizing user: {}", userId);

        StepResult scrub = runStep(CleanupStep.SCRUB_USER, () -> {
            userAccess.update(scrubPolicy.anonymize(user, now));
            return 1;
        });
        if (!scrub.succeeded()) {
            return List.of(scrub);
        }

        // Content rows stay and show the sentinel name; only credential, device and consent data go
        Map<CleanupStep, IntSupplier> cleanup = new LinkedHashMap<>();
        cleanup.put(CleanupStep.DETACH_AUDIT_LOGS, () -> auditLogAccess.detachUser(userId));
        cleanup.put(CleanupStep.DELETE_PUSH_TOKENS, () -> pushTokenAccess.deleteByUserId(userId));
        cleanup.put(CleanupStep.DELETE_REFRESH_TOKENS, () -> refreshTokenAccess.deleteByUserId(userId));
        cleanup.put(CleanupStep.DELETE_CONSENT_RECORDS, () -> consentRecordAccess.deleteByUserId(userId));

        List<StepResult> steps = new ArrayList<>();
        steps.add(scrub);
        steps.addAll(runConcurrently(cleanup));
        return steps;
    }

    private List<StepResult> fullDelete(User user) {
        String userId = user.getId();
        log.info("Deleting user: {}", userId);

        Map<CleanupStep, IntSupplier> personalData = new LinkedHashMap<>();
        personalData.put(CleanupStep.DELETE_NOTIFICATIONS, () -> notificationAccess.deleteByUserId(userId));
        personalData.put(CleanupStep.DELETE_PUSH_TOKENS, () -> pushTokenAccess.deleteByUserId(userId));
        personalData.put(CleanupStep.DELETE_REFRESH_TOKENS, () -> refreshTokenAccess.deleteByUserId(userId));
        personalData.put(CleanupStep.DELETE_CONSENT_RECORDS, () -> consentRecordAccess.deleteByUserId(userId));
        personalData.put(CleanupStep.DETACH_AUDIT_LOGS, () -> auditLogAccess.detachUser(userId));

        List<StepResult> steps = new ArrayList<>(runConcurrently(personalData));
        if (steps.stream().allMatch(StepResult::succeeded)) {
            steps.add(runStep(CleanupStep.DELETE_USER, () -> {
                userAccess.delete(userId);
                return 1;
            }));
        }
        return steps;
    }

    private List<StepResult> runConcurrently(Map<CleanupStep, IntSupplier> actions) {
        List<CompletableFuture<StepResult>> futures = actions.entrySet().stream()
                .map(e -> CompletableFuture.supplyAsync(() -> runStep(e.getKey(), e.getValue()), cleanupExecutor))
                .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    private StepResult runStep(CleanupStep step, IntSupplier action) {
        try {
            int affected = action.getAsInt();
            log.debug("Cleanup step {} affected {} rows", step, affected);
            return StepResult.success(step, affected);
        } catch (Exception ex) {
            log.warn("Cleanup step {} failed: {}", step, ex.getMessage());
            return StepResult.failure(step, JobResult.describe(ex));
        }
    }

    private RecordOutcome complete(DeletionRequest request, Mode mode, List<StepResult> steps, Instant now) {
        // The write is refused once the stored row has left PENDING
        DeletionRequest completed = request.toBuilder().build().markCompleted(now.toEpochMilli());
        if (!deletionRequestAccess.completeIfPending(completed)) {
            log.warn("Deletion request {} left PENDING while it was being processed, not marking completed",
                    request.getId());
            return RecordOutcome.skipped(mode, steps);
        }
        steps.add(StepResult.success(CleanupStep.COMPLETE_REQUEST, 1));
        return RecordOutcome.completed(mode, steps);
    }

    private static String failureMessage(DeletionRequest request, String cause) {
        return "Failed to process deletion for user " + request.getUserId() + ": " + cause;
    }
}
