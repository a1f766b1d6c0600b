package com.dcaswap.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Atomic updates on schedules used by the dispatcher and the swap pipeline.
 */
public interface ScheduleRepositoryCustom {

    /**
     * Atomically locks the earliest due, enabled schedule whose lock is free or older than staleLockBefore.
     * Sets lockedAt and lastRunAt to now and returns the updated document.
     */
    Optional<Schedule> claimNextDue(Instant now, Instant staleLockBefore);

    /** Writes only app.version; returns false when the schedule no longer exists. */
    boolean updateAppVersion(String scheduleId, int version);

    /** Releases the lock and records the run outcome. failReason is ignored for SUCCEEDED. */
    void markFinished(String scheduleId, ScheduleRunStatus status, String failReason,
                      Instant finishedAt, Instant nextRunAt);

    /** Releases the lock without recording a run (the claimed job was never started). */
    void releaseLock(String scheduleId);

    /** @return false when no schedule has this id */
    boolean setDisabled(String scheduleId, boolean disabled, Instant updatedAt);

    /**
     * Overwrites the editable fields without touching the lock or run bookkeeping. A parked schedule
     * (nextRunAt null) becomes due at updatedAt.
     *
     * @return false when no schedule has this id
     */
    boolean applyEdit(String scheduleId, ScheduleEdit edit, Instant updatedAt);
}
