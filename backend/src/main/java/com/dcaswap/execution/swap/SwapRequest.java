package com.dcaswap.execution.swap;

import java.math.BigInteger;

/**
 * One approve+swap for a delegated wallet. amountIn is in tokenIn base units.
 */
public record SwapRequest(
        String delegatorEthAddress,
        String tokenInAddress,
        String tokenOutAddress,
        BigInteger amountIn
) {
}
