package com.dcaswap.dca.job;

import com.dcaswap.common.DcaFailureKind;
import com.dcaswap.common.DcaSwapException;
import com.dcaswap.common.PurchaseIntervals;
import com.dcaswap.config.AsyncConfig;
import com.dcaswap.config.DcaSchedulerProperties;
import com.dcaswap.dca.DcaJob;
import com.dcaswap.dca.DcaSwapPipeline;
import com.dcaswap.dca.observability.JobScope;
import com.dcaswap.dca.observability.ObservabilitySink;
import com.dcaswap.domain.Schedule;
import com.dcaswap.domain.ScheduleRepository;
import com.dcaswap.domain.ScheduleRunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Claims due schedules and runs each one on dca-executor, at most max-concurrency at a time.
 * A claim sets lockedAt atomically, so a schedule never runs twice concurrently across instances.
 * Whatever the outcome, the next run is lastRunAt plus the schedule's interval; failures are recorded,
 * not retried.
 */
@Component
@ConditionalOnProperty(prefix = "dca.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DueScheduleDispatcher {

    private final ScheduleRepository scheduleRepository;
    private final DcaSwapPipeline pipeline;
    private final ObservabilitySink observabilitySink;
    private final DcaSchedulerProperties properties;
    private final Clock clock;
    private final Executor dcaExecutor;
    private final Semaphore slots;

    public DueScheduleDispatcher(ScheduleRepository scheduleRepository,
                                 DcaSwapPipeline pipeline,
                                 ObservabilitySink observabilitySink,
                                 DcaSchedulerProperties properties,
                                 Clock clock,
                                 @Qualifier(AsyncConfig.DCA_EXECUTOR) Executor dcaExecutor) {
        this.scheduleRepository = scheduleRepository;
        this.pipeline = pipeline;
        this.observabilitySink = observabilitySink;
        this.properties = properties;
        this.clock = clock;
        this.dcaExecutor = dcaExecutor;
        this.slots = new Semaphore(Math.max(1, properties.getMaxConcurrency()));
    }

    @Scheduled(fixedDelayString = "${dca.scheduler.poll-interval-ms:10000}")
    public void dispatchDue() {
        int dispatched = 0;
        while (slots.tryAcquire()) {
            Optional<Schedule> claimed;
            try {
                Instant now = clock.instant();
                claimed = scheduleRepository.claimNextDue(now, now.minus(properties.getLockLifetime()));
            } catch (RuntimeException e) {
                slots.release();
                log.warn("Claiming due schedules failed: {}", e.getMessage());
                break;
            }
            if (claimed.isEmpty()) {
                slots.release();
                break;
            }
            Schedule schedule = claimed.get();
            try {
                dcaExecutor.execute(() -> {
                    try {
                        runClaimed(schedule);
                    } finally {
                        slots.release();
                    }
                });
                dispatched++;
            } catch (RejectedExecutionException e) {
                slots.release();
                scheduleRepository.releaseLock(schedule.getId());
                log.warn("dca-executor rejected schedule {}, lock released", schedule.getId());
                break;
            }
        }
        if (dispatched > 0) {
            log.debug("Dispatched {} due schedule(s)", dispatched);
        }
    }

    void runClaimed(Schedule schedule) {
        String scheduleId = schedule.getId();
        Instant startedAt = schedule.getLastRunAt() != null ? schedule.getLastRunAt() : clock.instant();
        Instant nextRunAt = nextRunAt(schedule, startedAt);
        JobScope scope = new JobScope(scheduleId, observabilitySink, clock);
        try {
            pipeline.execute(DcaJob.fromSchedule(schedule), scope);
            scheduleRepository.markFinished(scheduleId, ScheduleRunStatus.SUCCEEDED, null, clock.instant(), nextRunAt);
            log.info("Schedule {} succeeded, next run at {}", scheduleId, nextRunAt);
        } catch (DcaSwapException e) {
            scheduleRepository.markFinished(scheduleId, ScheduleRunStatus.FAILED,
                    failReason(e.getKind(), e.getMessage()), clock.instant(), nextRunAt);
            log.info("Schedule {} failed with {}, next run at {}", scheduleId, e.getKind(), nextRunAt);
        } catch (RuntimeException e) {
            scheduleRepository.markFinished(scheduleId, ScheduleRunStatus.FAILED,
                    failReason(DcaFailureKind.UNEXPECTED_FAILURE, e.getMessage()), clock.instant(), nextRunAt);
            log.error("Schedule {} failed unexpectedly", scheduleId, e);
        }
    }

    /**
     * Null parks the schedule (never due again) when its stored interval cannot be parsed or added to startedAt.
     */
    static Instant nextRunAt(Schedule schedule, Instant startedAt) {
        try {
            return startedAt.plus(PurchaseIntervals.parse(schedule.getPurchaseIntervalHuman()));
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException e) {
            log.error("Schedule {} has an unparsable interval '{}', it will not run again until edited",
                    schedule.getId(), schedule.getPurchaseIntervalHuman());
            return null;
        }
    }

    static String failReason(DcaFailureKind kind, String message) {
        return kind + ": " + message;
    }
}
