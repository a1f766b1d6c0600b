package com.dcaswap.domain;

public enum ScheduleRunStatus {
    SUCCEEDED,
    FAILED
}
