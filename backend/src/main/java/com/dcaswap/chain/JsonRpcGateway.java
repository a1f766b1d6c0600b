package com.dcaswap.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * Rate-limited, retrying JSON-RPC calls against one endpoint group. Returns the "result" member;
 * a JSON null result (e.g. a receipt that is not available yet) is returned as {@link NullNode}, not an error.
 */
@Slf4j
public class JsonRpcGateway {

    private final String name;
    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public JsonRpcGateway(String name, EvmRpcClient rpcClient, RpcEndpointRotator rotator,
                          RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.name = name;
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    public JsonNode call(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                RateLimiter.waitForPermission(rateLimiter);
                String json = rpcClient.call(endpoint, method, params).block();
                return extractResult(method, json);
            } catch (Exception e) {
                lastException = e;
                log.debug("{} {} attempt {} failed: {}", name, method, attempt + 1, messageOf(e));
            }
        }
        throw new RpcException(name + " " + method + " failed after " + rotator.getMaxAttempts()
                + " attempts: " + messageOf(lastException), lastException);
    }

    /** Endpoint passed on to services that talk to the same chain themselves. */
    public String primaryEndpoint() {
        return rotator.getPrimaryEndpoint();
    }

    private JsonNode extractResult(String method, String json) throws Exception {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty " + method + " response");
        }
        JsonNode root = objectMapper.readTree(json);
        if (root.hasNonNull("error")) {
            throw new RpcException(method + " error: " + root.get("error"));
        }
        JsonNode result = root.get("result");
        return result == null ? NullNode.getInstance() : result;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
