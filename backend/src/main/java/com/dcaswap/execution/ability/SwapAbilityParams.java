package com.dcaswap.execution.ability;

/**
 * Parameters of one precheck/execute call. amountIn is a base-unit integer string.
 */
public record SwapAbilityParams(
        String tokenInAddress,
        String tokenOutAddress,
        SwapAction action,
        String amountIn,
        String rpcUrl,
        boolean alchemyGasSponsor,
        String alchemyGasSponsorApiKey,
        String alchemyGasSponsorPolicyId
) {
}
