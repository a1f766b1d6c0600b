package com.dcaswap.execution.ability;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of an Aerodrome swap as named on the execution service's wire.
 */
public enum SwapAction {
    APPROVE("approve"),
    SWAP("swap");

    private final String wireName;

    SwapAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
