package com.dcaswap.common;

/**
 * Failure taxonomy of one scheduled swap run. Stored as the job's fail reason prefix and used as the metrics tag.
 */
public enum DcaFailureKind {
    INSUFFICIENT_BALANCE,
    AUTHORIZATION_REVOKED,
    PRECHECK_FAILED,
    PHASE_EXECUTION_FAILED,
    CONFIRMATION_TIMEOUT,
    CONFIRMATION_REVERTED,
    UNEXPECTED_FAILURE
}
