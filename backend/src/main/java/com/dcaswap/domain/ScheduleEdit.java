package com.dcaswap.domain;

import java.math.BigDecimal;

/**
 * User-editable fields of a schedule. App, owner and run bookkeeping are not editable.
 */
public record ScheduleEdit(
        String name,
        BigDecimal purchaseAmount,
        String purchaseIntervalHuman,
        TokenRef tokenIn,
        TokenRef tokenOut
) {
}
