package com.dcaswap.authorization;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * GET {serviceUrl}/apps/{appId}/delegators/{ethAddress}/permitted-version. 404 or a null version means none.
 * Other error statuses propagate as WebClientResponseException.
 */
@Slf4j
public class WebClientPermittedVersionClient implements PermittedVersionClient {

    private final WebClient webClient;
    private final String serviceUrl;
    private final Duration timeout;

    public WebClientPermittedVersionClient(WebClient.Builder builder, String serviceUrl, Duration timeout) {
        this.webClient = builder.build();
        this.serviceUrl = serviceUrl;
        this.timeout = timeout;
    }

    @Override
    public Optional<Integer> getPermittedVersion(String ethAddress, long appId) {
        PermittedVersionResponse response = webClient.get()
                .uri(serviceUrl + "/apps/{appId}/delegators/{ethAddress}/permitted-version", appId, ethAddress)
                .<PermittedVersionResponse>exchangeToMono(r -> {
                    if (r.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return r.releaseBody().then(Mono.empty());
                    }
                    if (r.statusCode().isError()) {
                        return r.createException().flatMap(e -> Mono.<PermittedVersionResponse>error(e));
                    }
                    return r.bodyToMono(PermittedVersionResponse.class);
                })
                .block(timeout);
        Optional<Integer> version = Optional.ofNullable(response).map(PermittedVersionResponse::version);
        log.debug("Permitted version for {} on app {}: {}", ethAddress, appId, version.orElse(null));
        return version;
    }
}
