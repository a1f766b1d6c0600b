package com.dcaswap.dca.observability;

import com.dcaswap.common.DcaSwapException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs captured failures with their breadcrumb trail and counts runs in Micrometer:
 * dca.swap.failures tagged by kind, dca.swap.completed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingObservabilitySink implements ObservabilitySink {

    static final String FAILURES_METRIC = "dca.swap.failures";
    static final String COMPLETED_METRIC = "dca.swap.completed";

    private final MeterRegistry meterRegistry;

    @Override
    public void captureException(String scheduleId, DcaSwapException exception, List<Breadcrumb> breadcrumbs) {
        Counter.builder(FAILURES_METRIC)
                .description("Scheduled swap runs that failed")
                .tag("kind", exception.getKind().name())
                .register(meterRegistry)
                .increment();
        log.warn("Schedule {} failed with {}: {}; breadcrumbs: {}",
                scheduleId, exception.getKind(), exception.getMessage(), breadcrumbs);
    }

    @Override
    public void recordSuccess(String scheduleId, String txHash) {
        Counter.builder(COMPLETED_METRIC)
                .description("Scheduled swap runs that completed")
                .register(meterRegistry)
                .increment();
    }
}
