package com.dcaswap.authorization;

import com.dcaswap.common.DcaFailureKind;
import com.dcaswap.common.DcaSwapException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides which app version a run executes under. The live permitted version always wins; parameter
 * compatibility between versions is not checked.
 */
@Component
public class AuthorizationVersionResolver {

    /**
     * @throws DcaSwapException AUTHORIZATION_REVOKED when no live version is permitted
     */
    public VersionResolution resolve(String ethAddress, int storedVersion, Optional<Integer> liveVersion) {
        if (liveVersion == null || liveVersion.isEmpty()) {
            throw new DcaSwapException(DcaFailureKind.AUTHORIZATION_REVOKED,
                    "User " + ethAddress + " revoked permission to run this app. Used version to generate: "
                            + storedVersion);
        }
        int live = liveVersion.get();
        return new VersionResolution(live, live != storedVersion);
    }
}
