package com.dcaswap.chain;

import java.math.BigInteger;

/**
 * Hex quantity and ABI word helpers.
 */
public final class EvmHex {

    private EvmHex() {
    }

    /** "0x..." quantity or 32-byte word to an unsigned integer; null, "0x" and blank are zero. */
    public static BigInteger toBigInteger(String hex) {
        if (hex == null || hex.isBlank()) {
            return BigInteger.ZERO;
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.isBlank()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(normalized, 16);
    }

    /** Left-pads an address to a 32-byte ABI word (no 0x prefix). */
    public static String addressWord(String address) {
        String hex = address != null && address.startsWith("0x") ? address.substring(2) : address;
        if (hex == null) {
            return "0".repeat(64);
        }
        return String.format("%64s", hex).replace(' ', '0').toLowerCase();
    }
}
