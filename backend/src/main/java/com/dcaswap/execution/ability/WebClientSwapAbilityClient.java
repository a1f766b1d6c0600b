package com.dcaswap.execution.ability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * POSTs {params, context} to {executorUrl}/abilities/aerodrome-swap/{precheck|execute}.
 * Error statuses carrying a response envelope are returned as unsuccessful responses.
 */
@Slf4j
public class WebClientSwapAbilityClient implements SwapAbilityClient {

    private static final String ABILITY_PATH = "/abilities/aerodrome-swap/";

    private final WebClient webClient;
    private final String executorUrl;
    private final Duration timeout;

    public WebClientSwapAbilityClient(WebClient.Builder builder, String executorUrl, Duration timeout) {
        this.webClient = builder.build();
        this.executorUrl = executorUrl;
        this.timeout = timeout;
    }

    @Override
    public AbilityResponse precheck(SwapAbilityParams params, SwapAbilityContext context) {
        return post("precheck", params, context);
    }

    @Override
    public AbilityResponse execute(SwapAbilityParams params, SwapAbilityContext context) {
        return post("execute", params, context);
    }

    private AbilityResponse post(String operation, SwapAbilityParams params, SwapAbilityContext context) {
        AbilityResponse response;
        try {
            response = webClient.post()
                    .uri(executorUrl + ABILITY_PATH + operation)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new AbilityRequest(params, context))
                    .exchangeToMono(r -> r.bodyToMono(AbilityResponse.class)
                            .onErrorResume(e -> Mono.empty())
                            .switchIfEmpty(Mono.error(new AbilityClientException(
                                    "Aerodrome " + params.action().wireName() + " " + operation
                                            + " returned HTTP " + r.statusCode().value() + " without a result"))))
                    .block(timeout);
        } catch (WebClientException e) {
            throw new AbilityClientException("Aerodrome " + params.action().wireName() + " " + operation
                    + " request failed: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) elapsed
            throw new AbilityClientException("Aerodrome " + params.action().wireName() + " " + operation
                    + " timed out after " + timeout, e);
        }
        log.trace("Aerodrome {} {} response: {}", params.action().wireName(), operation, response);
        return response;
    }
}
