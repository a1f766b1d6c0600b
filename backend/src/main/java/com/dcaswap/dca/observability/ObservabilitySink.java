package com.dcaswap.dca.observability;

import com.dcaswap.common.DcaSwapException;

import java.util.List;

/**
 * Destination for run failures and outcomes.
 */
public interface ObservabilitySink {

    void captureException(String scheduleId, DcaSwapException exception, List<Breadcrumb> breadcrumbs);

    void recordSuccess(String scheduleId, String txHash);
}
