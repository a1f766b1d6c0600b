package com.dcaswap.chain.config;

import com.dcaswap.chain.EvmRpcClient;
import com.dcaswap.chain.JsonRpcGateway;
import com.dcaswap.chain.RpcEndpointRotator;
import com.dcaswap.chain.WebClientEvmRpcClient;
import com.dcaswap.common.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * JSON-RPC gateways: chainRpcGateway (balances, receipts) and bundlerRpcGateway (user operation receipts).
 * Both share one transport client and one Resilience4j rate limiter.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainConfig {

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(ChainProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getRateLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean(name = "chainRpcGateway")
    public JsonRpcGateway chainRpcGateway(EvmRpcClient evmRpcClient,
                                          @Qualifier("evmRpcRateLimiter") RateLimiter rateLimiter,
                                          ChainProperties properties,
                                          ObjectMapper objectMapper) {
        RpcEndpointRotator rotator = new RpcEndpointRotator(properties.getRpcUrls(), retryPolicy(properties));
        return new JsonRpcGateway("chain", evmRpcClient, rotator, rateLimiter, objectMapper);
    }

    /** Falls back to the chain node endpoints when no dedicated bundler is configured. */
    @Bean(name = "bundlerRpcGateway")
    public JsonRpcGateway bundlerRpcGateway(EvmRpcClient evmRpcClient,
                                            @Qualifier("evmRpcRateLimiter") RateLimiter rateLimiter,
                                            ChainProperties properties,
                                            ObjectMapper objectMapper) {
        List<String> urls = properties.getBundlerUrls() == null || properties.getBundlerUrls().isEmpty()
                ? properties.getRpcUrls()
                : properties.getBundlerUrls();
        RpcEndpointRotator rotator = new RpcEndpointRotator(urls, retryPolicy(properties));
        return new JsonRpcGateway("bundler", evmRpcClient, rotator, rateLimiter, objectMapper);
    }

    private static RetryPolicy retryPolicy(ChainProperties properties) {
        ChainProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(),
                retry.getJitterFactor(), retry.getMaxAttempts());
    }
}
