package com.dcaswap.pricing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Time-bounded cache of the registry token list. The whole list is one entry that expires ttl after it
 * was loaded; expiry is measured on the injected clock so staleness boundaries are testable.
 */
@Slf4j
public class TokenRegistryCache {

    private static final String LISTED_TOKENS = "listed-tokens";

    private final TokenRegistryClient registryClient;
    private final Cache<String, List<TokenQuote>> cache;

    public TokenRegistryCache(TokenRegistryClient registryClient, Duration ttl, Clock clock) {
        this.registryClient = registryClient;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .maximumSize(1)
                .build();
    }

    /** Cached list; loads from the registry on first use and after expiry. */
    public List<TokenQuote> get() {
        return cache.get(LISTED_TOKENS, key -> load());
    }

    /** Bypasses and refreshes the cache. */
    public List<TokenQuote> getFresh() {
        List<TokenQuote> tokens = load();
        cache.put(LISTED_TOKENS, tokens);
        return tokens;
    }

    public void invalidate() {
        cache.invalidateAll();
    }

    private List<TokenQuote> load() {
        List<TokenQuote> tokens = List.copyOf(registryClient.fetchListedTokens());
        log.debug("Loaded {} listed tokens from registry", tokens.size());
        return tokens;
    }
}
