package com.dcaswap.execution.ability;

public record AbilityRequest(SwapAbilityParams params, SwapAbilityContext context) {
}
