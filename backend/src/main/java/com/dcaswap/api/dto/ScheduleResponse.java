package com.dcaswap.api.dto;

import com.dcaswap.domain.AppRef;
import com.dcaswap.domain.PkpInfo;
import com.dcaswap.domain.Schedule;
import com.dcaswap.domain.TokenRef;

import java.time.Instant;

public record ScheduleResponse(
        String id,
        String name,
        AppRef app,
        PkpInfo pkpInfo,
        String purchaseAmount,
        String purchaseIntervalHuman,
        TokenRef tokenIn,
        TokenRef tokenOut,
        boolean disabled,
        Instant nextRunAt,
        Instant lastRunAt,
        Instant lastFinishedAt,
        String lastRunStatus,
        String failReason,
        int failCount,
        Instant createdAt,
        Instant updatedAt
) {

    public static ScheduleResponse from(Schedule s) {
        return new ScheduleResponse(
                s.getId(),
                s.getName(),
                s.getApp(),
                s.getPkpInfo(),
                s.getPurchaseAmount() != null ? s.getPurchaseAmount().toPlainString() : null,
                s.getPurchaseIntervalHuman(),
                s.getTokenIn(),
                s.getTokenOut(),
                s.isDisabled(),
                s.getNextRunAt(),
                s.getLastRunAt(),
                s.getLastFinishedAt(),
                s.getLastRunStatus() != null ? s.getLastRunStatus().name() : null,
                s.getFailReason(),
                s.getFailCount(),
                s.getCreatedAt(),
                s.getUpdatedAt());
    }
}
