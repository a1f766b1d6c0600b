package com.dcaswap.execution.ability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * result member of an execution service response. Precheck fills reason; execute fills the hashes
 * of the operations it submitted (none when nothing needed submitting).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AbilityResultPayload(
        String reason,
        String approvalTxHash,
        String approvalTxUserOperationHash,
        String swapTxHash,
        String swapTxUserOperationHash
) {
}
