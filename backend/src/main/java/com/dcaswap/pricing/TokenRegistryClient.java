package com.dcaswap.pricing;

import java.util.List;

/**
 * Source of listed tokens and their prices. Implementations always hit the registry; caching is
 * {@link TokenRegistryCache}'s job.
 */
public interface TokenRegistryClient {

    List<TokenQuote> fetchListedTokens();
}
