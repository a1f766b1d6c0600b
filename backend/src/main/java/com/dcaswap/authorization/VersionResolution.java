package com.dcaswap.authorization;

/**
 * Version a run must use, and whether it differs from the one stored on the schedule.
 */
public record VersionResolution(int version, boolean upgraded) {
}
