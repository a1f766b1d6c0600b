package com.dcaswap.pricing.config;

import com.dcaswap.chain.config.ChainProperties;
import com.dcaswap.pricing.TokenRegistryCache;
import com.dcaswap.pricing.TokenRegistryClient;
import com.dcaswap.pricing.registry.WebClientTokenRegistryClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Pricing module configuration: registry client and the registry cache owned by the application context.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    public TokenRegistryClient tokenRegistryClient(WebClient.Builder webClientBuilder,
                                                   PricingProperties pricingProperties,
                                                   ChainProperties chainProperties) {
        return new WebClientTokenRegistryClient(
                webClientBuilder,
                pricingProperties.getRegistryUrl(),
                chainProperties.getChainId(),
                Duration.ofSeconds(pricingProperties.getReadTimeoutSeconds()));
    }

    @Bean
    public TokenRegistryCache tokenRegistryCache(TokenRegistryClient tokenRegistryClient,
                                                 PricingProperties pricingProperties,
                                                 Clock clock) {
        return new TokenRegistryCache(
                tokenRegistryClient,
                Duration.ofSeconds(pricingProperties.getCacheTtlSeconds()),
                clock);
    }
}
