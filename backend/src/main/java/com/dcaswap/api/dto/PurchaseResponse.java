package com.dcaswap.api.dto;

import com.dcaswap.domain.PurchasedCoin;

import java.time.Instant;

public record PurchaseResponse(
        String id,
        String ethAddress,
        String coinAddress,
        String name,
        String symbol,
        String purchaseAmount,
        String scheduleId,
        String txHash,
        Instant createdAt
) {

    public static PurchaseResponse from(PurchasedCoin p) {
        return new PurchaseResponse(p.getId(), p.getEthAddress(), p.getCoinAddress(), p.getName(), p.getSymbol(),
                p.getPurchaseAmount(), p.getScheduleId(), p.getTxHash(), p.getCreatedAt());
    }
}
