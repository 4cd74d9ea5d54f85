package com.example.datalifecycle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Master switch for cron registration (compliance.scheduler.*). With the switch off the jobs
 * can still be run on demand through the job endpoints.
 */
@Component
@ConfigurationProperties(prefix = "compliance.scheduler")
@Data
public class SchedulerProperties {

    private boolean enabled = false;
    private String zone = "UTC";
}
