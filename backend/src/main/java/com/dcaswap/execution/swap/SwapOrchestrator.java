package com.dcaswap.execution.swap;

import com.dcaswap.chain.JsonRpcGateway;
import com.dcaswap.common.DcaFailureKind;
import com.dcaswap.common.DcaSwapException;
import com.dcaswap.execution.OperationHandle;
import com.dcaswap.execution.ability.AbilityClientException;
import com.dcaswap.execution.ability.AbilityResponse;
import com.dcaswap.execution.ability.AbilityResultPayload;
import com.dcaswap.execution.ability.SwapAbilityClient;
import com.dcaswap.execution.ability.SwapAbilityContext;
import com.dcaswap.execution.ability.SwapAbilityParams;
import com.dcaswap.execution.ability.SwapAction;
import com.dcaswap.execution.config.ExecutionProperties;
import com.dcaswap.execution.confirmation.OperationConfirmationWaiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs the approve phase then the swap phase against the execution service. Each phase is precheck then
 * execute; a submitted approval is confirmed before the swap is prechecked. No retries.
 */
@Service
@Slf4j
public class SwapOrchestrator {

    private final SwapAbilityClient abilityClient;
    private final OperationConfirmationWaiter confirmationWaiter;
    private final ExecutionProperties executionProperties;
    private final JsonRpcGateway chainRpcGateway;

    public SwapOrchestrator(SwapAbilityClient abilityClient,
                            OperationConfirmationWaiter confirmationWaiter,
                            ExecutionProperties executionProperties,
                            @Qualifier("chainRpcGateway") JsonRpcGateway chainRpcGateway) {
        this.abilityClient = abilityClient;
        this.confirmationWaiter = confirmationWaiter;
        this.executionProperties = executionProperties;
        this.chainRpcGateway = chainRpcGateway;
    }

    public OperationHandle swap(SwapRequest request) {
        return swap(request, SubmissionListener.NONE);
    }

    /**
     * @return handle of the submitted swap, not yet confirmed
     */
    public OperationHandle swap(SwapRequest request, SubmissionListener listener) {
        SwapAbilityContext context = new SwapAbilityContext(request.delegatorEthAddress());

        Optional<OperationHandle> approval = runPhase(SwapAction.APPROVE, request, context);
        if (approval.isPresent()) {
            listener.onSubmitted(SwapAction.APPROVE, approval.get());
            log.debug("Waiting for approval {} to be mined", approval.get());
            confirmationWaiter.waitForSettlement(approval.get());
            log.debug("Approval {} mined", approval.get());
        } else {
            log.debug("Approval already sufficient, no transaction needed");
        }

        OperationHandle swap = runPhase(SwapAction.SWAP, request, context)
                .orElseThrow(() -> new DcaSwapException(DcaFailureKind.PHASE_EXECUTION_FAILED,
                        "Aerodrome swap execution returned no operation hash"));
        listener.onSubmitted(SwapAction.SWAP, swap);
        return swap;
    }

    private Optional<OperationHandle> runPhase(SwapAction action, SwapRequest request, SwapAbilityContext context) {
        SwapAbilityParams params = paramsFor(action, request);

        AbilityResponse precheck;
        try {
            precheck = abilityClient.precheck(params, context);
        } catch (AbilityClientException e) {
            throw new DcaSwapException(DcaFailureKind.PRECHECK_FAILED,
                    "Aerodrome " + action.wireName() + " precheck failed: " + e.getMessage(), e);
        }
        if (precheck == null || !precheck.success()) {
            throw new DcaSwapException(DcaFailureKind.PRECHECK_FAILED,
                    "Aerodrome " + action.wireName() + " precheck failed: "
                            + (precheck == null ? null : precheck.reason()));
        }

        AbilityResponse execution;
        try {
            execution = abilityClient.execute(params, context);
        } catch (AbilityClientException e) {
            throw new DcaSwapException(DcaFailureKind.PHASE_EXECUTION_FAILED,
                    "Aerodrome " + action.wireName() + " execution failed: " + e.getMessage(), e);
        }
        if (execution == null || !execution.success()) {
            throw new DcaSwapException(DcaFailureKind.PHASE_EXECUTION_FAILED,
                    "Aerodrome " + action.wireName() + " execution failed: "
                            + (execution == null ? null : execution.runtimeError()));
        }
        return handleOf(action, execution.result());
    }

    static Optional<OperationHandle> handleOf(SwapAction action, AbilityResultPayload result) {
        if (result == null) {
            return Optional.empty();
        }
        String userOperationHash = action == SwapAction.APPROVE
                ? result.approvalTxUserOperationHash() : result.swapTxUserOperationHash();
        String txHash = action == SwapAction.APPROVE ? result.approvalTxHash() : result.swapTxHash();
        if (userOperationHash != null && !userOperationHash.isBlank()) {
            return Optional.of(OperationHandle.sponsored(userOperationHash));
        }
        if (txHash != null && !txHash.isBlank()) {
            return Optional.of(OperationHandle.direct(txHash));
        }
        return Optional.empty();
    }

    private SwapAbilityParams paramsFor(SwapAction action, SwapRequest request) {
        return new SwapAbilityParams(
                request.tokenInAddress(),
                request.tokenOutAddress(),
                action,
                request.amountIn().toString(),
                chainRpcGateway.primaryEndpoint(),
                executionProperties.isGasSponsor(),
                executionProperties.getGasSponsorApiKey(),
                executionProperties.getGasSponsorPolicyId());
    }
}
