package com.dcaswap.execution.ability;

/**
 * Aerodrome swap ability of the execution service. Signing, routing and gas sponsorship happen there.
 */
public interface SwapAbilityClient {

    AbilityResponse precheck(SwapAbilityParams params, SwapAbilityContext context);

    AbilityResponse execute(SwapAbilityParams params, SwapAbilityContext context);
}
