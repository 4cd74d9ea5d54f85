package com.example.datalifecycle.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "compliance.push-tokens")
@Validated
@Data
public class PushTokenCleanupProperties {

    private boolean enabled = true;

    @NotBlank
    private String schedule = "0 30 2 * * *";  // Daily at 02:30 UTC

    @Min(1)
    private int inactiveDays = 90;
}
