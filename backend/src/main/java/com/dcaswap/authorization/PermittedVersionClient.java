package com.dcaswap.authorization;

import java.util.Optional;

/**
 * Live lookup of the app version a delegator currently permits. Never cached.
 */
public interface PermittedVersionClient {

    /**
     * @return empty when the delegator permits no version of the app (revoked or never granted)
     */
    Optional<Integer> getPermittedVersion(String ethAddress, long appId);
}
