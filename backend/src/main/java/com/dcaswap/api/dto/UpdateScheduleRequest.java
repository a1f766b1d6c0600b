package com.dcaswap.api.dto;

import com.dcaswap.api.validation.UsdAmount;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * PUT /api/v1/schedules/{scheduleId} request body. Same rules as creation for the fields it carries.
 */
public record UpdateScheduleRequest(
        String name,

        @NotBlank(message = "INVALID_PURCHASE_AMOUNT")
        @UsdAmount
        String purchaseAmount,

        @NotBlank(message = "INVALID_INTERVAL")
        String purchaseIntervalHuman,

        @NotNull(message = "INVALID_TOKEN")
        @Valid
        CreateScheduleRequest.Token tokenIn,

        @NotNull(message = "INVALID_TOKEN")
        @Valid
        CreateScheduleRequest.Token tokenOut
) {
}
