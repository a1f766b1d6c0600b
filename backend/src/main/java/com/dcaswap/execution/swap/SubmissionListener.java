package com.dcaswap.execution.swap;

import com.dcaswap.execution.OperationHandle;
import com.dcaswap.execution.ability.SwapAction;

/**
 * Notified as soon as a phase reports a submitted operation, before it is confirmed.
 */
@FunctionalInterface
public interface SubmissionListener {

    SubmissionListener NONE = (action, handle) -> { };

    void onSubmitted(SwapAction action, OperationHandle handle);
}
