package com.dcaswap.common;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human purchase intervals ("1 day", "12 hours", "2 weeks", "daily") into durations.
 * A month is 30 days. Intervals longer than {@link #MAX_INTERVAL} are rejected.
 */
public final class PurchaseIntervals {

    /** Ten years. */
    public static final Duration MAX_INTERVAL = Duration.ofDays(3650);

    private static final Pattern AMOUNT_AND_UNIT = Pattern.compile("^(\\d+)\\s*([a-z]+)$");

    private static final Map<String, Duration> UNITS = Map.ofEntries(
            Map.entry("minute", Duration.ofMinutes(1)),
            Map.entry("minutes", Duration.ofMinutes(1)),
            Map.entry("hour", Duration.ofHours(1)),
            Map.entry("hours", Duration.ofHours(1)),
            Map.entry("day", Duration.ofDays(1)),
            Map.entry("days", Duration.ofDays(1)),
            Map.entry("week", Duration.ofDays(7)),
            Map.entry("weeks", Duration.ofDays(7)),
            Map.entry("month", Duration.ofDays(30)),
            Map.entry("months", Duration.ofDays(30))
    );

    private static final Map<String, Duration> ALIASES = Map.of(
            "hourly", Duration.ofHours(1),
            "daily", Duration.ofDays(1),
            "weekly", Duration.ofDays(7),
            "monthly", Duration.ofDays(30)
    );

    private PurchaseIntervals() {
    }

    /**
     * @throws IllegalArgumentException when the text is blank, zero, longer than ten years or uses an unknown unit
     */
    public static Duration parse(String human) {
        if (human == null || human.isBlank()) {
            throw new IllegalArgumentException("Purchase interval is required");
        }
        String normalized = human.trim().toLowerCase(Locale.ROOT);
        Duration alias = ALIASES.get(normalized);
        if (alias != null) {
            return alias;
        }
        Matcher m = AMOUNT_AND_UNIT.matcher(normalized);
        if (!m.matches()) {
            throw new IllegalArgumentException("Unrecognized purchase interval: " + human);
        }
        Duration unit = UNITS.get(m.group(2));
        if (unit == null) {
            throw new IllegalArgumentException("Unrecognized purchase interval: " + human);
        }
        // Nine digits keep the product below Duration capacity for every unit.
        if (m.group(1).length() > 9) {
            throw new IllegalArgumentException("Purchase interval too long: " + human);
        }
        long amount = Long.parseLong(m.group(1));
        if (amount <= 0) {
            throw new IllegalArgumentException("Unrecognized purchase interval: " + human);
        }
        Duration interval = unit.multipliedBy(amount);
        if (interval.compareTo(MAX_INTERVAL) > 0) {
            throw new IllegalArgumentException("Purchase interval too long: " + human);
        }
        return interval;
    }

    public static boolean isValid(String human) {
        try {
            parse(human);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
