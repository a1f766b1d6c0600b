package com.dcaswap.pricing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenServiceTest {

    private static final TokenQuote AERO = new TokenQuote(
            "0x940181a94A35A4569E4529A3CDfB74e38FD98631", 18, "AERO", "Aerodrome", "1.2345", true);

    @Mock
    TokenRegistryCache tokenRegistryCache;

    @InjectMocks
    TokenService tokenService;

    @Test
    void findByAddress_isCaseInsensitive() {
        when(tokenRegistryCache.get()).thenReturn(List.of(AERO));

        assertThat(tokenService.findByAddress("0x940181a94a35a4569e4529a3cdfb74e38fd98631")).contains(AERO);
    }

    @Test
    void findByAddress_unknown_isEmpty() {
        when(tokenRegistryCache.get()).thenReturn(List.of(AERO));

        assertThat(tokenService.findByAddress("0x0000000000000000000000000000000000000001")).isEmpty();
    }

    @Test
    void findByAddress_blank_doesNotTouchRegistry() {
        assertThat(tokenService.findByAddress(" ")).isEmpty();
        verifyNoInteractions(tokenRegistryCache);
    }
}
