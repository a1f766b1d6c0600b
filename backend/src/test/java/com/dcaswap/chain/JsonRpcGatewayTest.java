package com.dcaswap.chain;

import com.dcaswap.common.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JsonRpcGatewayTest {

    @Mock
    EvmRpcClient rpcClient;

    JsonRpcGateway gateway;

    @BeforeEach
    void setUp() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(
                List.of("https://a.rpc", "https://b.rpc"), new RetryPolicy(0L, 0L, 0, 3));
        gateway = new JsonRpcGateway("chain", rpcClient, rotator, RateLimiter.ofDefaults("test"), new ObjectMapper());
    }

    @Test
    void call_returnsResultMember() {
        when(rpcClient.call(eq("https://a.rpc"), eq("eth_blockNumber"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}"));

        JsonNode result = gateway.call("eth_blockNumber", List.of());

        assertThat(result.asText()).isEqualTo("0x10");
    }

    @Test
    @DisplayName("null result (receipt not available yet) is a NullNode, not an error")
    void call_nullResult_returnsNullNode() {
        when(rpcClient.call(anyString(), eq("eth_getTransactionReceipt"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"));

        assertThat(gateway.call("eth_getTransactionReceipt", List.of("0xabc")).isNull()).isTrue();
    }

    @Test
    @DisplayName("transport failure on one endpoint is retried on the next")
    void call_rotatesEndpointsOnFailure() {
        when(rpcClient.call(eq("https://a.rpc"), eq("eth_call"), any()))
                .thenReturn(Mono.error(new RpcException("eth_call unreachable")));
        when(rpcClient.call(eq("https://b.rpc"), eq("eth_call"), any()))
                .thenReturn(Mono.just("{\"result\":\"0x01\"}"));

        assertThat(gateway.call("eth_call", List.of(Map.of(), "latest")).asText()).isEqualTo("0x01");
    }

    @Test
    void call_errorMemberOnEveryAttempt_throwsRpcException() {
        when(rpcClient.call(anyString(), eq("eth_call"), any()))
                .thenReturn(Mono.just("{\"error\":{\"code\":-32000,\"message\":\"execution reverted\"}}"));

        assertThatThrownBy(() -> gateway.call("eth_call", List.of()))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("failed after 3 attempts")
                .hasMessageContaining("execution reverted");
        verify(rpcClient, times(3)).call(anyString(), eq("eth_call"), any());
    }
}
