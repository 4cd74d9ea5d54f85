package com.example.datalifecycle.service;

import com.example.datalifecycle.access.PushTokenAccess;
import com.example.datalifecycle.config.PushTokenCleanupProperties;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class PushTokenCleanupJob implements ComplianceJob {

    public static final String NAME = "cleanup-push-tokens";

    private final PushTokenCleanupProperties properties;
    private final PushTokenAccess pushTokenAccess;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Delete push tokens not used in " + properties.getInactiveDays() + " days";
    }

    @Override
    public String schedule() {
        return properties.getSchedule();
    }

    @Override
    public boolean enabled() {
        return properties.isEnabled();
    }

    @Override
    public JobResult run(Instant now) {
        try {
            Instant cutoff = now.minus(Duration.ofDays(properties.getInactiveDays()));
            log.info("Starting cleanup of push tokens unused since {}", cutoff);

            int deletedCount = pushTokenAccess.deleteLastUsedBefore(cutoff.toEpochMilli());

            log.info("Cleanup completed: deletedCount={}, cutoffDate={}", deletedCount, cutoff);

            return new JobReport()
                    .counter("deletedCount", deletedCount)
                    .attribute("cutoffDate", cutoff.toString())
                    .attribute("inactiveDays", properties.getInactiveDays())
                    .toResult(String.format("Deleted %d inactive push tokens", deletedCount));
        } catch (Exception ex) {
            log.error("Failed to cleanup push tokens: {}", ex.getMessage(), ex);
            return JobResult.failure("Failed to cleanup push tokens", ex);
        }
    }
}
