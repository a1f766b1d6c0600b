package com.dcaswap.dca;

import com.dcaswap.domain.AppRef;
import com.dcaswap.domain.PkpInfo;
import com.dcaswap.domain.Schedule;
import com.dcaswap.domain.TokenRef;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * One due occurrence of a schedule, snapshotted at claim time. Only the app reference changes during a run,
 * when the permitted version has moved on.
 */
@Getter
@AllArgsConstructor
public class DcaJob {

    private final String scheduleId;
    private final String name;
    private AppRef app;
    private final PkpInfo pkpInfo;
    private final BigDecimal purchaseAmount;
    private final String purchaseIntervalHuman;
    private final TokenRef tokenIn;
    private final TokenRef tokenOut;

    public static DcaJob fromSchedule(Schedule schedule) {
        return new DcaJob(
                schedule.getId(),
                schedule.getName(),
                schedule.getApp(),
                schedule.getPkpInfo(),
                schedule.getPurchaseAmount(),
                schedule.getPurchaseIntervalHuman(),
                schedule.getTokenIn(),
                schedule.getTokenOut());
    }

    void setApp(AppRef app) {
        this.app = app;
    }

    public String getEthAddress() {
        return pkpInfo.ethAddress();
    }
}
