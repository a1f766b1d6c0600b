package com.dcaswap.execution.ability;

/** The delegated wallet the ability acts for. */
public record SwapAbilityContext(String delegatorPkpEthAddress) {
}
