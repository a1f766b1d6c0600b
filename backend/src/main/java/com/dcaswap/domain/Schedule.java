package com.dcaswap.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's standing recurring-purchase instruction plus the dispatcher's bookkeeping for it.
 * User fields are written by ScheduleService; app.version is patched by DcaSwapPipeline when the user's
 * permitted version drifted; nextRunAt/lockedAt/last* are owned by DueScheduleDispatcher.
 */
@Document(collection = "schedules")
@CompoundIndex(name = "due_unlocked", def = "{'disabled': 1, 'nextRunAt': 1, 'lockedAt': 1}")
@CompoundIndex(name = "owner", def = "{'pkpInfo.ethAddress': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Schedule {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private AppRef app;
    private PkpInfo pkpInfo;
    private BigDecimal purchaseAmount;
    private String purchaseIntervalHuman;
    private TokenRef tokenIn;
    private TokenRef tokenOut;
    private Instant createdAt;
    private Instant updatedAt;

    private boolean disabled;
    private Instant nextRunAt;
    /** Set while a run is in flight; a lock older than the configured lifetime is considered abandoned. */
    private Instant lockedAt;
    private Instant lastRunAt;
    private Instant lastFinishedAt;
    private ScheduleRunStatus lastRunStatus;
    private String failReason;
    private int failCount;
}
