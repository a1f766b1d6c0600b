package com.dcaswap.authorization;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientPermittedVersionClientTest {

    private static final String USER = "0x1111111111111111111111111111111111111111";

    @Test
    void returnsPermittedVersion() {
        AtomicReference<String> url = new AtomicReference<>();
        PermittedVersionClient client = clientReturning(HttpStatus.OK, "{\"version\":7}", url);

        assertThat(client.getPermittedVersion(USER, 42L)).contains(7);
        assertThat(url.get()).isEqualTo("http://auth.test/apps/42/delegators/" + USER + "/permitted-version");
    }

    @Test
    void nullVersion_isEmpty() {
        assertThat(clientReturning(HttpStatus.OK, "{\"version\":null}", new AtomicReference<>())
                .getPermittedVersion(USER, 42L)).isEmpty();
    }

    @Test
    void notFound_isEmpty() {
        assertThat(clientReturning(HttpStatus.NOT_FOUND, "{\"error\":\"not found\"}", new AtomicReference<>())
                .getPermittedVersion(USER, 42L)).isEmpty();
    }

    @Test
    void serverError_propagates() {
        PermittedVersionClient client = clientReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{}", new AtomicReference<>());

        assertThatThrownBy(() -> client.getPermittedVersion(USER, 42L))
                .isInstanceOf(WebClientResponseException.class);
    }

    private static PermittedVersionClient clientReturning(HttpStatus status, String body, AtomicReference<String> url) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            url.set(request.url().toString());
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new WebClientPermittedVersionClient(builder, "http://auth.test", Duration.ofSeconds(5));
    }
}
