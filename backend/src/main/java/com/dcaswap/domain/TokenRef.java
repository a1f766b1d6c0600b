package com.dcaswap.domain;

/**
 * ERC-20 token as captured on a schedule: contract address, base-unit decimals and display symbol.
 */
public record TokenRef(String address, int decimals, String symbol) {

    public boolean sameAddress(TokenRef other) {
        return other != null && address != null && address.equalsIgnoreCase(other.address());
    }
}
