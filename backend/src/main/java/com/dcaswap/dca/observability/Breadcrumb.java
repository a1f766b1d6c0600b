package com.dcaswap.dca.observability;

import java.time.Instant;
import java.util.Map;

/**
 * A fact recorded during a run, attached to the failure report if the run fails.
 */
public record Breadcrumb(String message, Map<String, Object> data, Instant timestamp) {

    public Breadcrumb {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
