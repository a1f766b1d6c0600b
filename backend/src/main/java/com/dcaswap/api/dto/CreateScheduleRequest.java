package com.dcaswap.api.dto;

import com.dcaswap.api.validation.EvmAddress;
import com.dcaswap.api.validation.UsdAmount;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/schedules request body. Validated with Jakarta Bean Validation; tokenIn != tokenOut and the
 * interval are checked by ScheduleService.
 */
public record CreateScheduleRequest(
        String name,

        @NotNull(message = "INVALID_APP")
        @Valid
        App app,

        @NotNull(message = "INVALID_ADDRESS")
        @Valid
        PkpInfo pkpInfo,

        @NotBlank(message = "INVALID_PURCHASE_AMOUNT")
        @UsdAmount
        String purchaseAmount,

        @NotBlank(message = "INVALID_INTERVAL")
        String purchaseIntervalHuman,

        @NotNull(message = "INVALID_TOKEN")
        @Valid
        Token tokenIn,

        @NotNull(message = "INVALID_TOKEN")
        @Valid
        Token tokenOut
) {

    public record App(
            @NotNull(message = "INVALID_APP") Long id,
            @NotNull(message = "INVALID_APP") @Min(value = 1, message = "INVALID_APP") Integer version
    ) {
    }

    public record PkpInfo(
            @NotBlank(message = "INVALID_ADDRESS") @EvmAddress String ethAddress,
            @NotBlank(message = "INVALID_PKP") String publicKey,
            @NotBlank(message = "INVALID_PKP") String tokenId
    ) {
    }

    /** ERC-20 decimals are a uint8; 77 is the most a uint256 amount can carry. */
    public record Token(
            @NotBlank(message = "INVALID_TOKEN") @EvmAddress(message = "INVALID_TOKEN") String address,
            @NotNull(message = "INVALID_TOKEN")
            @Min(value = 0, message = "INVALID_TOKEN")
            @Max(value = 77, message = "INVALID_TOKEN")
            Integer decimals,
            @NotBlank(message = "INVALID_TOKEN") String symbol
    ) {
    }
}
