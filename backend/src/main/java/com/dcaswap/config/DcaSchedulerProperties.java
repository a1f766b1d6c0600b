package com.dcaswap.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Due-schedule dispatching: poll cadence, concurrency bound and stale-lock lifetime.
 */
@ConfigurationProperties(prefix = "dca.scheduler")
@Getter
@Setter
public class DcaSchedulerProperties {

    /** When false the dispatcher is not registered (API-only instance). */
    private boolean enabled = true;

    /** Delay between the end of one dispatch pass and the start of the next. */
    private long pollIntervalMs = 10_000;

    /** Maximum number of schedules running at once on this instance. */
    private int maxConcurrency = 4;

    /** A claim older than this is treated as abandoned (crashed instance) and may be claimed again. */
    private Duration lockLifetime = Duration.ofMinutes(10);
}
