package com.example.datalifecycle.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "compliance.audit.purge")
@Validated
@Data
public class AuditPurgeProperties {

    private boolean enabled = true;

    @NotBlank
    private String schedule = "0 30 3 * * SUN";  // Weekly, Sunday 03:30 UTC

    @Min(1)
    private int retentionYears = 3;
}
