package com.dcaswap.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain node and gas-sponsor bundler endpoints, RPC throttling and retry settings.
 */
@ConfigurationProperties(prefix = "dca.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** Chain the schedules run on (Base mainnet by default). */
    private long chainId = 8453;

    /** Chain node JSON-RPC endpoints; the first one is also handed to the execution service. */
    private List<String> rpcUrls = new ArrayList<>(List.of("https://mainnet.base.org"));

    /** ERC-4337 bundler endpoints used to resolve sponsored user operations. */
    private List<String> bundlerUrls = new ArrayList<>();

    /** Global JSON-RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a rate-limiter permit before failing the attempt. */
    private long rateLimiterTimeoutMs = 2_000;

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        private long baseDelayMs = 500;
        private long maxDelayMs = 8_000;
        private double jitterFactor = 0.2;
        private int maxAttempts = 3;
    }
}
