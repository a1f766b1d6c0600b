package com.dcaswap.pricing.registry;

import com.dcaswap.pricing.TokenQuote;
import com.dcaswap.pricing.TokenRegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Fetches GET {registryUrl}/tokens and keeps listed tokens of the configured chain.
 * Registry prices (18 decimals) are truncated to four decimals for display and conversion.
 */
@Slf4j
public class WebClientTokenRegistryClient implements TokenRegistryClient {

    private static final BigInteger PRICE_TRUNCATION = BigInteger.TEN.pow(14);
    private static final int PRICE_DISPLAY_DECIMALS = 4;

    private final WebClient webClient;
    private final String registryUrl;
    private final long chainId;
    private final Duration timeout;

    public WebClientTokenRegistryClient(WebClient.Builder builder, String registryUrl, long chainId, Duration timeout) {
        this.webClient = builder.build();
        this.registryUrl = registryUrl;
        this.chainId = chainId;
        this.timeout = timeout;
    }

    @Override
    public List<TokenQuote> fetchListedTokens() {
        List<RegistryToken> tokens = webClient.get()
                .uri(registryUrl + "/tokens")
                .retrieve()
                .bodyToFlux(RegistryToken.class)
                .collectList()
                .block(timeout);
        if (tokens == null) {
            return List.of();
        }
        return tokens.stream()
                .filter(t -> Boolean.TRUE.equals(t.listed()))
                .filter(t -> t.chainId() == null || t.chainId() == chainId)
                .map(WebClientTokenRegistryClient::toQuote)
                .filter(Objects::nonNull)
                .toList();
    }

    static TokenQuote toQuote(RegistryToken token) {
        if (token.address() == null || token.decimals() == null) {
            log.debug("Skipping registry token without address or decimals: {}", token.symbol());
            return null;
        }
        return new TokenQuote(
                token.address(),
                token.decimals(),
                token.symbol(),
                token.name(),
                formatPrice(token.price()),
                true);
    }

    /** "1000000000000000000" -> "1.0000"; zero, negative or missing -> null. */
    static String formatPrice(String rawPrice) {
        if (rawPrice == null || rawPrice.isBlank()) {
            return null;
        }
        BigInteger raw;
        try {
            raw = new BigInteger(rawPrice.trim());
        } catch (NumberFormatException e) {
            log.debug("Unparsable registry price '{}'", rawPrice);
            return null;
        }
        if (raw.signum() <= 0) {
            return null;
        }
        return new BigDecimal(raw.divide(PRICE_TRUNCATION), PRICE_DISPLAY_DECIMALS).toPlainString();
    }
}
