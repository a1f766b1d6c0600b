package com.dcaswap.dca.schedule;

import lombok.Getter;

/**
 * Thrown by ScheduleService when a request breaks a business rule.
 * The API maps SCHEDULE_NOT_FOUND to 404 and the rest to 400.
 */
@Getter
public class ScheduleServiceException extends RuntimeException {

    public static final String SCHEDULE_NOT_FOUND = "SCHEDULE_NOT_FOUND";
    public static final String SAME_TOKEN = "SAME_TOKEN";
    public static final String INVALID_INTERVAL = "INVALID_INTERVAL";

    /** SCHEDULE_NOT_FOUND, SAME_TOKEN or INVALID_INTERVAL. */
    private final String errorCode;

    public ScheduleServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
