package com.dcaswap.pricing.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Token entry as served by the registry. price is the USD unit price as an 18-decimal integer string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryToken(
        String address,
        Long chainId,
        Integer decimals,
        Boolean listed,
        String name,
        String price,
        String symbol
) {
}
