package com.dcaswap.chain;

/**
 * Thrown when a JSON-RPC call fails (HTTP error, JSON-RPC error object, or unreadable response).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
