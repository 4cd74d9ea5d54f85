package com.example.datalifecycle.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the deletion finalization job.
 * These values are bound from application.yml (compliance.deletion.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "compliance.deletion")
@Validated
@Data
public class DeletionFinalizationProperties {

    private boolean enabled = true;

    @NotBlank
    private String schedule = "0 30 4 * * *";  // Daily at 04:30 UTC

    @Min(0)
    private int gracePeriodDays = 30;

    // Threads available for one record's independent cleanup writes
    @Min(1)
    private int cleanupParallelism = 4;
}
