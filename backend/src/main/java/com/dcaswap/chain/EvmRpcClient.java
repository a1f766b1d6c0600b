package com.dcaswap.chain;

import reactor.core.publisher.Mono;

/**
 * JSON-RPC transport abstraction. Retries and endpoint rotation live in {@link JsonRpcGateway}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL (chain node or bundler)
     * @param method      e.g. "eth_call", "eth_getUserOperationReceipt"
     * @param params      positional params
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
