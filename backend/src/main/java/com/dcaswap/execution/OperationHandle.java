package com.dcaswap.execution;

import java.util.Objects;

/**
 * Reference to a submitted on-chain operation: an ERC-4337 user operation when gas is sponsored, otherwise a
 * plain transaction. Built once from the execution service's response.
 */
public record OperationHandle(Kind kind, String hash) {

    public enum Kind {
        /** hash is a user operation hash resolved through the bundler. */
        SPONSORED,
        /** hash is a transaction hash. */
        DIRECT
    }

    public OperationHandle {
        Objects.requireNonNull(kind, "kind");
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("Operation hash is required");
        }
    }

    public static OperationHandle sponsored(String userOperationHash) {
        return new OperationHandle(Kind.SPONSORED, userOperationHash);
    }

    public static OperationHandle direct(String txHash) {
        return new OperationHandle(Kind.DIRECT, txHash);
    }

    @Override
    public String toString() {
        return kind + "(" + hash + ")";
    }
}
