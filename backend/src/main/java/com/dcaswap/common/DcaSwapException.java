package com.dcaswap.common;

import lombok.Getter;

/**
 * Typed failure of a scheduled swap run. Raised by the converter, resolver, orchestrator and waiter; rethrown
 * unchanged in kind by DcaSwapPipeline so the dispatcher can mark the job failed.
 */
@Getter
public class DcaSwapException extends RuntimeException {

    private final DcaFailureKind kind;

    public DcaSwapException(DcaFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DcaSwapException(DcaFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
