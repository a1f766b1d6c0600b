package com.dcaswap.execution.ability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Envelope returned by both precheck and execute.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AbilityResponse(boolean success, AbilityResultPayload result, String runtimeError) {

    public String reason() {
        return result == null ? null : result.reason();
    }
}
