package com.dcaswap.dca.observability;

import com.dcaswap.common.DcaSwapException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-run trail of breadcrumbs plus access to the sink. Not shared between runs.
 * Sink failures are logged and never reach the run.
 */
@Slf4j
public class JobScope {

    private final String scheduleId;
    private final ObservabilitySink sink;
    private final Clock clock;
    private final List<Breadcrumb> breadcrumbs = new ArrayList<>();

    public JobScope(String scheduleId, ObservabilitySink sink, Clock clock) {
        this.scheduleId = scheduleId;
        this.sink = sink;
        this.clock = clock;
    }

    public void addBreadcrumb(String message, Map<String, Object> data) {
        synchronized (breadcrumbs) {
            breadcrumbs.add(new Breadcrumb(message, data, clock.instant()));
        }
    }

    public List<Breadcrumb> getBreadcrumbs() {
        synchronized (breadcrumbs) {
            return List.copyOf(breadcrumbs);
        }
    }

    public void captureException(DcaSwapException exception) {
        try {
            sink.captureException(scheduleId, exception, getBreadcrumbs());
        } catch (RuntimeException e) {
            log.warn("Failed to report failure of schedule {} to observability sink: {}", scheduleId, e.getMessage());
        }
    }

    public void recordSuccess(String txHash) {
        try {
            sink.recordSuccess(scheduleId, txHash);
        } catch (RuntimeException e) {
            log.warn("Failed to report success of schedule {} to observability sink: {}", scheduleId, e.getMessage());
        }
    }

    public String getScheduleId() {
        return scheduleId;
    }
}
