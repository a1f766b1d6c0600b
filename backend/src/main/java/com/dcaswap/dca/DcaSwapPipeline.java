package com.dcaswap.dca;

import com.dcaswap.authorization.AuthorizationVersionResolver;
import com.dcaswap.authorization.PermittedVersionClient;
import com.dcaswap.authorization.VersionResolution;
import com.dcaswap.authorization.config.AuthorizationProperties;
import com.dcaswap.chain.Erc20BalanceReader;
import com.dcaswap.common.DcaFailureKind;
import com.dcaswap.common.DcaSwapException;
import com.dcaswap.config.AsyncConfig;
import com.dcaswap.dca.observability.JobScope;
import com.dcaswap.domain.PurchasedCoin;
import com.dcaswap.domain.PurchasedCoinRepository;
import com.dcaswap.domain.ScheduleRepository;
import com.dcaswap.domain.TokenRef;
import com.dcaswap.execution.OperationHandle;
import com.dcaswap.execution.confirmation.OperationConfirmationWaiter;
import com.dcaswap.execution.swap.SwapOrchestrator;
import com.dcaswap.execution.swap.SwapRequest;
import com.dcaswap.pricing.TokenQuote;
import com.dcaswap.pricing.TokenService;
import com.dcaswap.pricing.UsdTokenAmountConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static com.dcaswap.pricing.UsdTokenAmountConverter.formatUnits;

/**
 * Executes one due DCA job: reads balance, permitted version and tokenIn price concurrently, converts the USD
 * budget to tokenIn base units, checks balance and authorization, runs approve+swap, waits for the swap to
 * settle and inserts one PurchasedCoin. Any failure is reported to the job scope, logged and rethrown as a
 * {@link DcaSwapException}; nothing is persisted for a failed run apart from a version patch made before the swap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DcaSwapPipeline {

    private final Erc20BalanceReader balanceReader;
    private final PermittedVersionClient permittedVersionClient;
    private final TokenService tokenService;
    private final UsdTokenAmountConverter amountConverter;
    private final AuthorizationVersionResolver versionResolver;
    private final SwapOrchestrator swapOrchestrator;
    private final OperationConfirmationWaiter confirmationWaiter;
    private final ScheduleRepository scheduleRepository;
    private final PurchasedCoinRepository purchasedCoinRepository;
    private final AuthorizationProperties authorizationProperties;
    private final Clock clock;
    @Qualifier(AsyncConfig.DCA_IO_EXECUTOR)
    private final Executor ioExecutor;

    public PurchasedCoin execute(DcaJob job, JobScope scope) {
        try {
            PurchasedCoin purchase = run(job, scope);
            scope.recordSuccess(purchase.getTxHash());
            return purchase;
        } catch (RuntimeException e) {
            DcaSwapException failure = e instanceof DcaSwapException dse
                    ? dse
                    : new DcaSwapException(DcaFailureKind.UNEXPECTED_FAILURE,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
            scope.captureException(failure);
            log.error("DCA swap for schedule {} failed [{}]: {}",
                    job.getScheduleId(), failure.getKind(), failure.getMessage(), failure);
            throw failure;
        }
    }

    private PurchasedCoin run(DcaJob job, JobScope scope) {
        String ethAddress = job.getEthAddress();
        TokenRef tokenIn = job.getTokenIn();
        TokenRef tokenOut = job.getTokenOut();
        log.info("Starting DCA swap job {} for {}: ${} {} -> {}",
                job.getScheduleId(), ethAddress, job.getPurchaseAmount(), tokenIn.symbol(), tokenOut.symbol());

        CompletableFuture<BigInteger> balanceFuture = CompletableFuture.supplyAsync(
                () -> balanceReader.balanceOf(tokenIn.address(), ethAddress), ioExecutor);
        CompletableFuture<Optional<Integer>> versionFuture = CompletableFuture.supplyAsync(
                () -> permittedVersionClient.getPermittedVersion(ethAddress, authorizationProperties.getAppId()),
                ioExecutor);
        CompletableFuture<Optional<TokenQuote>> quoteFuture = CompletableFuture.supplyAsync(
                () -> tokenService.findByAddress(tokenIn.address()), ioExecutor);
        BigInteger balance = join(balanceFuture);
        Optional<Integer> permittedVersion = join(versionFuture);
        Optional<TokenQuote> quote = join(quoteFuture);

        scope.addBreadcrumb("User " + tokenIn.symbol() + " balance", Map.of(
                "tokenInBalance", formatUnits(balance, tokenIn.decimals()),
                "tokenInSymbol", tokenIn.symbol()));

        BigInteger amountIn = amountConverter.toBaseUnits(job.getPurchaseAmount(),
                quote.map(TokenQuote::price).orElse(null), tokenIn.decimals(), tokenIn.symbol());
        scope.addBreadcrumb("Purchase amount", Map.of(
                "purchaseAmountUsd", job.getPurchaseAmount().toPlainString(),
                "amountIn", formatUnits(amountIn, tokenIn.decimals())));

        if (balance.compareTo(amountIn) < 0) {
            throw new DcaSwapException(DcaFailureKind.INSUFFICIENT_BALANCE,
                    "Not enough balance for account " + ethAddress
                            + " - has " + formatUnits(balance, tokenIn.decimals()) + " " + tokenIn.symbol()
                            + ", needs " + formatUnits(amountIn, tokenIn.decimals()) + " " + tokenIn.symbol()
                            + " (=$" + job.getPurchaseAmount().toPlainString() + " USD) to DCA");
        }

        VersionResolution resolution = versionResolver.resolve(ethAddress, job.getApp().version(), permittedVersion);
        Map<String, Object> versionData = new LinkedHashMap<>();
        versionData.put("storedVersion", job.getApp().version());
        versionData.put("appVersionToRun", resolution.version());
        scope.addBreadcrumb("App version", versionData);
        if (resolution.upgraded()) {
            log.info("Schedule {} moves from app version {} to permitted version {}",
                    job.getScheduleId(), job.getApp().version(), resolution.version());
            job.setApp(job.getApp().withVersion(resolution.version()));
            scheduleRepository.updateAppVersion(job.getScheduleId(), resolution.version());
        }

        OperationHandle swapHandle = swapOrchestrator.swap(
                new SwapRequest(ethAddress, tokenIn.address(), tokenOut.address(), amountIn),
                (action, handle) -> scope.addBreadcrumb("Submitted " + action.wireName(),
                        Map.of("operation", handle.toString())));

        String swapTxHash = confirmationWaiter.waitForSettlement(swapHandle);
        scope.addBreadcrumb("Swap settled", Map.of("swapHash", swapTxHash));

        PurchasedCoin purchase = new PurchasedCoin();
        purchase.setEthAddress(ethAddress);
        purchase.setCoinAddress(tokenOut.address());
        purchase.setName(tokenOut.symbol());
        purchase.setSymbol(tokenOut.symbol());
        purchase.setPurchaseAmount(job.getPurchaseAmount().setScale(2, RoundingMode.HALF_UP).toPlainString());
        purchase.setScheduleId(job.getScheduleId());
        purchase.setTxHash(swapTxHash);
        purchase.setCreatedAt(clock.instant());
        purchasedCoinRepository.insert(purchase);

        log.info("Purchased ${} of {} with {} for schedule {} at tx {}",
                job.getPurchaseAmount(), tokenOut.symbol(), tokenIn.symbol(), job.getScheduleId(), swapTxHash);
        return purchase;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
