package com.dcaswap.pricing;

import com.dcaswap.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenRegistryCacheTest {

    private static final TokenQuote USDC_1 = new TokenQuote("0xusdc", 6, "USDC", "USD Coin", "1.0000", true);
    private static final TokenQuote USDC_2 = new TokenQuote("0xusdc", 6, "USDC", "USD Coin", "0.9990", true);

    @Mock
    TokenRegistryClient registryClient;

    MutableClock clock;
    TokenRegistryCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T00:00:00Z"));
        cache = new TokenRegistryCache(registryClient, Duration.ofMinutes(5), clock);
    }

    @Test
    @DisplayName("served from cache until the TTL elapses, refetched after")
    void stalenessBoundary() {
        when(registryClient.fetchListedTokens()).thenReturn(List.of(USDC_1), List.of(USDC_2));

        assertThat(cache.get()).containsExactly(USDC_1);
        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertThat(cache.get()).containsExactly(USDC_1);
        verify(registryClient, times(1)).fetchListedTokens();

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get()).containsExactly(USDC_2);
        verify(registryClient, times(2)).fetchListedTokens();
    }

    @Test
    void getFresh_bypassesAndRefreshes() {
        when(registryClient.fetchListedTokens()).thenReturn(List.of(USDC_1), List.of(USDC_2));

        cache.get();
        assertThat(cache.getFresh()).containsExactly(USDC_2);
        assertThat(cache.get()).containsExactly(USDC_2);
        verify(registryClient, times(2)).fetchListedTokens();
    }

    @Test
    void invalidate_forcesReload() {
        when(registryClient.fetchListedTokens()).thenReturn(List.of(USDC_1), List.of(USDC_2));

        cache.get();
        cache.invalidate();
        assertThat(cache.get()).containsExactly(USDC_2);
    }
}
