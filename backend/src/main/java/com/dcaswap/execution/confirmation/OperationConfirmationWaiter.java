package com.dcaswap.execution.confirmation;

import com.dcaswap.chain.JsonRpcGateway;
import com.dcaswap.chain.RpcException;
import com.dcaswap.common.DcaFailureKind;
import com.dcaswap.common.DcaSwapException;
import com.dcaswap.execution.OperationHandle;
import com.dcaswap.execution.config.ConfirmationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Polls until a submitted operation is mined and returns its transaction hash.
 * Sponsored handles are first resolved through the bundler (eth_getUserOperationReceipt), then the bundle
 * transaction is awaited on chain; direct handles go straight to eth_getTransactionReceipt.
 * Both legs share one deadline. RPC errors while polling are retried until the deadline; nothing is resubmitted.
 */
@Component
@Slf4j
public class OperationConfirmationWaiter {

    private static final String FAILED_STATUS = "0x0";

    private final JsonRpcGateway chainRpcGateway;
    private final JsonRpcGateway bundlerRpcGateway;
    private final ConfirmationProperties properties;
    private final Clock clock;

    public OperationConfirmationWaiter(@Qualifier("chainRpcGateway") JsonRpcGateway chainRpcGateway,
                                       @Qualifier("bundlerRpcGateway") JsonRpcGateway bundlerRpcGateway,
                                       ConfirmationProperties properties,
                                       Clock clock) {
        this.chainRpcGateway = chainRpcGateway;
        this.bundlerRpcGateway = bundlerRpcGateway;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return hash of the mined transaction
     * @throws DcaSwapException CONFIRMATION_REVERTED or CONFIRMATION_TIMEOUT
     */
    public String waitForSettlement(OperationHandle handle) {
        long deadline = clock.millis() + properties.getTimeout().toMillis();
        String txHash = handle.hash();
        if (handle.kind() == OperationHandle.Kind.SPONSORED) {
            JsonNode userOpReceipt = poll(bundlerRpcGateway, "eth_getUserOperationReceipt", handle, deadline);
            if (!userOpReceipt.path("success").asBoolean(false)) {
                throw new DcaSwapException(DcaFailureKind.CONFIRMATION_REVERTED,
                        "User operation " + handle.hash() + " reverted: "
                                + userOpReceipt.path("reason").asText("no reason given"));
            }
            txHash = userOpReceipt.path("receipt").path("transactionHash").asText(null);
            if (txHash == null || txHash.isBlank()) {
                throw new DcaSwapException(DcaFailureKind.CONFIRMATION_REVERTED,
                        "User operation " + handle.hash() + " receipt carries no transaction hash");
            }
            log.debug("User operation {} bundled in tx {}", handle.hash(), txHash);
        }
        JsonNode txReceipt = poll(chainRpcGateway, "eth_getTransactionReceipt", OperationHandle.direct(txHash), deadline);
        if (FAILED_STATUS.equalsIgnoreCase(txReceipt.path("status").asText())) {
            throw new DcaSwapException(DcaFailureKind.CONFIRMATION_REVERTED, "Transaction " + txHash + " reverted");
        }
        log.debug("Operation {} settled in tx {}", handle, txHash);
        return txHash;
    }

    private JsonNode poll(JsonRpcGateway gateway, String method, OperationHandle handle, long deadline) {
        while (true) {
            try {
                JsonNode receipt = gateway.call(method, List.of(handle.hash()));
                if (receipt != null && !receipt.isNull() && !receipt.isMissingNode()) {
                    return receipt;
                }
            } catch (RpcException e) {
                log.debug("{} for {} failed, polling again: {}", method, handle.hash(), e.getMessage());
            }
            long remaining = deadline - clock.millis();
            if (remaining <= 0) {
                throw new DcaSwapException(DcaFailureKind.CONFIRMATION_TIMEOUT,
                        "Operation " + handle + " not confirmed within " + properties.getTimeout());
            }
            sleep(Math.min(remaining, pollIntervalMs()));
        }
    }

    private long pollIntervalMs() {
        Duration interval = properties.getPollInterval();
        return interval == null ? 0L : Math.max(0L, interval.toMillis());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DcaSwapException(DcaFailureKind.CONFIRMATION_TIMEOUT, "Interrupted while awaiting confirmation", e);
        }
    }
}
