package com.dcaswap.dca.schedule;

import com.dcaswap.common.PurchaseIntervals;
import com.dcaswap.domain.Schedule;
import com.dcaswap.domain.ScheduleEdit;
import com.dcaswap.domain.ScheduleRepository;
import com.dcaswap.domain.TokenRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Creates, lists, edits, enables, disables and deletes schedules. A new schedule is due immediately;
 * an edit makes a parked schedule due again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    static final String DEFAULT_NAME = "DCASwap";

    private final ScheduleRepository scheduleRepository;
    private final Clock clock;

    public Schedule create(NewSchedule request) {
        checkTokensAndInterval(request.tokenIn(), request.tokenOut(), request.purchaseIntervalHuman());
        Instant now = clock.instant();
        Schedule schedule = new Schedule();
        schedule.setName(nameOrDefault(request.name()));
        schedule.setApp(request.app());
        schedule.setPkpInfo(request.pkpInfo());
        schedule.setPurchaseAmount(request.purchaseAmount());
        schedule.setPurchaseIntervalHuman(request.purchaseIntervalHuman().trim());
        schedule.setTokenIn(request.tokenIn());
        schedule.setTokenOut(request.tokenOut());
        schedule.setCreatedAt(now);
        schedule.setUpdatedAt(now);
        schedule.setNextRunAt(now);
        Schedule saved = scheduleRepository.insert(schedule);
        log.info("Created schedule {} for {}: ${} {} -> {} every {}",
                saved.getId(), request.pkpInfo().ethAddress(), request.purchaseAmount(),
                request.tokenIn().symbol(), request.tokenOut().symbol(), saved.getPurchaseIntervalHuman());
        return saved;
    }

    /**
     * Replaces name, amount, interval and tokens. Lock and run history are left as they are, so an edit
     * during a run takes effect from the next run.
     */
    public Schedule update(String scheduleId, ScheduleEdit edit) {
        checkTokensAndInterval(edit.tokenIn(), edit.tokenOut(), edit.purchaseIntervalHuman());
        ScheduleEdit normalized = new ScheduleEdit(nameOrDefault(edit.name()), edit.purchaseAmount(),
                edit.purchaseIntervalHuman().trim(), edit.tokenIn(), edit.tokenOut());
        if (!scheduleRepository.applyEdit(scheduleId, normalized, clock.instant())) {
            throw notFound(scheduleId);
        }
        log.info("Updated schedule {}: ${} {} -> {} every {}", scheduleId, normalized.purchaseAmount(),
                normalized.tokenIn().symbol(), normalized.tokenOut().symbol(), normalized.purchaseIntervalHuman());
        return scheduleRepository.findById(scheduleId).orElseThrow(() -> notFound(scheduleId));
    }

    /** Newest first. */
    public List<Schedule> listByOwner(String ethAddress) {
        return scheduleRepository.findByPkpInfoEthAddressOrderByCreatedAtDesc(ethAddress);
    }

    public void delete(String scheduleId) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw notFound(scheduleId);
        }
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule {}", scheduleId);
    }

    public Schedule enable(String scheduleId) {
        return setDisabled(scheduleId, false);
    }

    public Schedule disable(String scheduleId) {
        return setDisabled(scheduleId, true);
    }

    private Schedule setDisabled(String scheduleId, boolean disabled) {
        if (!scheduleRepository.setDisabled(scheduleId, disabled, clock.instant())) {
            throw notFound(scheduleId);
        }
        log.info("Schedule {} {}", scheduleId, disabled ? "disabled" : "enabled");
        return scheduleRepository.findById(scheduleId).orElseThrow(() -> notFound(scheduleId));
    }

    private static void checkTokensAndInterval(TokenRef tokenIn, TokenRef tokenOut, String interval) {
        if (tokenIn.sameAddress(tokenOut)) {
            throw new ScheduleServiceException(ScheduleServiceException.SAME_TOKEN,
                    "tokenIn and tokenOut must be different tokens");
        }
        if (!PurchaseIntervals.isValid(interval)) {
            throw new ScheduleServiceException(ScheduleServiceException.INVALID_INTERVAL,
                    "Unrecognized purchase interval: " + interval);
        }
    }

    private static String nameOrDefault(String name) {
        return name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
    }

    private static ScheduleServiceException notFound(String scheduleId) {
        return new ScheduleServiceException(ScheduleServiceException.SCHEDULE_NOT_FOUND,
                "Schedule not found: " + scheduleId);
    }
}
