package com.dcaswap.chain;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Reads ERC-20 balances in base units via eth_call balanceOf(owner) at the latest block.
 */
@Component
public class Erc20BalanceReader {

    /** keccak256("balanceOf(address)") first 4 bytes. */
    private static final String BALANCE_OF_SELECTOR = "0x70a08231";

    private final JsonRpcGateway chainRpcGateway;

    public Erc20BalanceReader(@Qualifier("chainRpcGateway") JsonRpcGateway chainRpcGateway) {
        this.chainRpcGateway = chainRpcGateway;
    }

    public BigInteger balanceOf(String tokenAddress, String ownerAddress) {
        String data = BALANCE_OF_SELECTOR + EvmHex.addressWord(ownerAddress);
        JsonNode result = chainRpcGateway.call("eth_call",
                List.of(Map.of("to", tokenAddress, "data", data), "latest"));
        if (result.isNull()) {
            throw new RpcException("balanceOf returned no result for token " + tokenAddress);
        }
        return EvmHex.toBigInteger(result.asText());
    }
}
