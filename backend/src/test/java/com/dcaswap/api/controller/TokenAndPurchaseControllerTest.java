package com.dcaswap.api.controller;

import com.dcaswap.dca.purchase.PurchaseQueryService;
import com.dcaswap.domain.PurchasedCoin;
import com.dcaswap.pricing.TokenQuote;
import com.dcaswap.pricing.TokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.URI;
import java.net.ConnectException;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {TokenController.class, PurchaseController.class})
class TokenAndPurchaseControllerTest {

    private static final String OWNER = "0x1111111111111111111111111111111111111111";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    TokenService tokenService;
    @MockBean
    PurchaseQueryService purchaseQueryService;

    @Test
    void tokens_listed() {
        when(tokenService.listTokens()).thenReturn(List.of(
                new TokenQuote("0xusdc", 6, "USDC", "USD Coin", "1.0000", true)));

        webTestClient.get().uri("/api/v1/tokens")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data[0].symbol").isEqualTo("USDC")
                .jsonPath("$.data[0].price").isEqualTo("1.0000");
    }

    @Test
    void tokens_empty_notFound() {
        when(tokenService.listTokens()).thenReturn(List.of());

        webTestClient.get().uri("/api/v1/tokens")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NO_TOKENS");
    }

    @Test
    void tokens_registryDown_badGateway() {
        when(tokenService.listTokens()).thenThrow(new WebClientRequestException(
                new ConnectException("refused"), HttpMethod.GET, URI.create("http://registry.test/tokens"), new HttpHeaders()));

        webTestClient.get().uri("/api/v1/tokens")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("UPSTREAM_UNAVAILABLE");
    }

    @Test
    void purchases_byOwner() {
        PurchasedCoin coin = new PurchasedCoin();
        coin.setEthAddress(OWNER);
        coin.setSymbol("AERO");
        coin.setPurchaseAmount("25.00");
        coin.setTxHash("0xtx");
        when(purchaseQueryService.findByOwner(OWNER)).thenReturn(List.of(coin));

        webTestClient.get().uri("/api/v1/purchases?ethAddress=" + OWNER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[0].purchaseAmount").isEqualTo("25.00")
                .jsonPath("$.data[0].txHash").isEqualTo("0xtx");
    }

    @Test
    void purchases_missingAddress_rejected() {
        webTestClient.get().uri("/api/v1/purchases")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }
}
