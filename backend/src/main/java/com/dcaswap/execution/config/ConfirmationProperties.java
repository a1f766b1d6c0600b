package com.dcaswap.execution.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Polling budget for waiting on submitted operations.
 */
@ConfigurationProperties(prefix = "dca.confirmation")
@Getter
@Setter
public class ConfirmationProperties {

    /** Total time allowed for one operation to settle, bundler and chain polling combined. */
    private Duration timeout = Duration.ofMinutes(3);

    private Duration pollInterval = Duration.ofSeconds(2);
}
