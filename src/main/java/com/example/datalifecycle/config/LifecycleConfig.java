package com.example.datalifecycle.config;

import com.example.datalifecycle.service.PiiScrubPolicy;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Beans shared by the lifecycle jobs: the clock every job reads "now" from, the scrub policy
 * and the pool that runs a single record's independent cleanup writes.
 */
@Configuration
public class LifecycleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PiiScrubPolicy piiScrubPolicy(AuditAnonymizationProperties properties) {
        return new PiiScrubPolicy(properties.getPiiMetadataKeys());
    }

    @Bean(name = "cleanupExecutor")
    public ThreadPoolTaskExecutor cleanupExecutor(DeletionFinalizationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCleanupParallelism());
        executor.setMaxPoolSize(properties.getCleanupParallelism());
        executor.setThreadNamePrefix("record-cleanup-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        // A record's cleanup must finish or fail before shutdown, never be dropped half way
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
