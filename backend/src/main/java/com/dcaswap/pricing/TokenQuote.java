package com.dcaswap.pricing;

/**
 * Listed token with its USD unit price (four-decimal string), as served by the registry cache.
 *
 * @param price null when the registry has no price for the token
 */
public record TokenQuote(
        String address,
        int decimals,
        String symbol,
        String name,
        String price,
        boolean listed
) {

    public boolean hasAddress(String other) {
        return address != null && address.equalsIgnoreCase(other);
    }
}
