package com.dcaswap.dca.schedule;

import com.dcaswap.domain.AppRef;
import com.dcaswap.domain.PkpInfo;
import com.dcaswap.domain.TokenRef;

import java.math.BigDecimal;

/**
 * User-supplied fields of a schedule, already format-validated by the API layer.
 */
public record NewSchedule(
        String name,
        AppRef app,
        PkpInfo pkpInfo,
        BigDecimal purchaseAmount,
        String purchaseIntervalHuman,
        TokenRef tokenIn,
        TokenRef tokenOut
) {
}
