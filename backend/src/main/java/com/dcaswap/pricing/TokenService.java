package com.dcaswap.pricing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to listed tokens and their USD prices, served from {@link TokenRegistryCache}.
 */
@Service
@RequiredArgsConstructor
public class TokenService {

    private final TokenRegistryCache tokenRegistryCache;

    public List<TokenQuote> listTokens() {
        return tokenRegistryCache.get();
    }

    /** Case-insensitive address lookup. Up to one cache TTL stale. */
    public Optional<TokenQuote> findByAddress(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        return tokenRegistryCache.get().stream()
                .filter(t -> t.hasAddress(address.trim()))
                .findFirst();
    }
}
