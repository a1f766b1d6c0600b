package com.dcaswap.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Token registry configuration. Documented in application.yml under dca.pricing.
 */
@ConfigurationProperties(prefix = "dca.pricing")
@Getter
@Setter
public class PricingProperties {

    /** Registry base URL; tokens are read from {registryUrl}/tokens. */
    private String registryUrl = "http://localhost:8081";

    /** How long a fetched token list (and its prices) may be served before refetching. */
    private int cacheTtlSeconds = 300;

    /** Timeout in seconds for one registry fetch. */
    private int readTimeoutSeconds = 15;
}
