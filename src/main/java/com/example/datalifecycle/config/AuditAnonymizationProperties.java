package com.example.datalifecycle.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for audit log anonymization (compliance.audit.anonymization.*).
 * {@code piiMetadataKeys} lists the top-level metadata keys removed from aged entries.
 */
@Component
@ConfigurationProperties(prefix = "compliance.audit.anonymization")
@Validated
@Data
public class AuditAnonymizationProperties {

    private boolean enabled = true;

    @NotBlank
    private String schedule = "0 0 3 * * *";  // Daily at 03:00 UTC

    @Min(0)
    private int retentionYears = 1;

    private List<String> piiMetadataKeys = new ArrayList<>(List.of("email", "name", "phoneNumber", "address"));
}
