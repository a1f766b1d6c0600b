package com.dcaswap.domain;

/**
 * Owner identity: the delegated wallet (PKP) that holds the spend token and signs the swap.
 */
public record PkpInfo(String ethAddress, String publicKey, String tokenId) {
}
