package com.flagship.deposit_ledger.pool;

import com.flagship.deposit_ledger.auth.AuthorizationPolicy;
import com.flagship.deposit_ledger.auth.LedgerOperation;
import com.flagship.deposit_ledger.custody.AssetCustody;
import com.flagship.deposit_ledger.event.DepositEvent;
import com.flagship.deposit_ledger.event.InterestRateUpdatedEvent;
import com.flagship.deposit_ledger.event.MarketInitializedEvent;
import com.flagship.deposit_ledger.event.WithdrawEvent;
import com.flagship.deposit_ledger.exception.LedgerErrorCode;
import com.flagship.deposit_ledger.exception.LedgerException;
import com.flagship.deposit_ledger.market.FixedPointMath;
import com.flagship.deposit_ledger.market.InterestLedger;
import com.flagship.deposit_ledger.market.LedgerCheckpoint;
import com.flagship.deposit_ledger.market.LedgerConfig;
import com.flagship.deposit_ledger.market.MarketSummary;
import com.flagship.deposit_ledger.observability.CorrelationContext;
import com.flagship.deposit_ledger.observability.LedgerMetrics;
import com.flagship.deposit_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates deposits and withdrawals between custody and the per-asset
 * interest ledgers.
 *
 * Key principles:
 * - One ledger per asset, registered once and never replaced
 * - Every public operation runs under a single lock, so calls are serialized
 *   and each one completes atomically relative to the others
 * - Deposit and withdraw additionally hold a reentrancy flag while custody is
 *   called; a mutating callback into the pool from custody is rejected
 * - All-or-nothing: shares are minted only after custody has pulled the funds,
 *   and a burn is rolled back if custody fails to push them out
 * - Shares are priced through the freshly advanced index in both directions,
 *   rounding against the caller
 * - An event is written to the outbox only once the operation has succeeded
 */
@Service
@Slf4j
public class PoolCoordinator {

    private final Map<String, InterestLedger> markets = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrancyGuard reentrancyGuard = new ReentrancyGuard();

    private final AssetCustody custody;
    private final AuthorizationPolicy authorizationPolicy;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;
    private final String coordinatorId;

    public PoolCoordinator(AssetCustody custody,
                           AuthorizationPolicy authorizationPolicy,
                           OutboxService outboxService,
                           LedgerMetrics ledgerMetrics,
                           Clock clock,
                           @Value("${ledger.coordinator-id}") String coordinatorId) {
        this.custody = custody;
        this.authorizationPolicy = authorizationPolicy;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
        this.coordinatorId = coordinatorId;
    }

    // ==================== Administration ====================

    /**
     * Creates the ledger for an asset with index 1e18 and the configured rate.
     *
     * @throws LedgerException UNAUTHORIZED if the caller is not the owner,
     *         MARKET_ALREADY_EXISTS if the asset already has a ledger
     */
    public MarketSummary initializeMarket(String caller, String assetId, LedgerConfig config) {
        lock.lock();
        try {
            reentrancyGuard.requireIdle("initializeMarket");
            requireAuthorized(caller, LedgerOperation.INITIALIZE_MARKET);
            requireAssetId(assetId);
            if (markets.containsKey(assetId)) {
                throw LedgerException.marketAlreadyExists(assetId);
            }

            InterestLedger ledger = new InterestLedger(assetId, config, authorizationPolicy, clock);
            markets.put(assetId, ledger);
            ledgerMetrics.registerIndexGauge(assetId, () -> previewIndex(ledger));

            outboxService.saveEvent(MarketInitializedEvent.of(assetId, config.getName(), config.getSymbol(),
                    config.getInitialRate(), clock.instant()));

            log.info("Market initialized: assetId={}, name={}, symbol={}, rate={}",
                    assetId, config.getName(), config.getSymbol(), config.getInitialRate());
            return ledger.summary();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles the current rate into the index, then applies the new one.
     *
     * @return the market after the change
     * @throws LedgerException REENTRANT_CALL when called back from custody
     *         during a deposit or withdraw
     */
    public MarketSummary setInterestRate(String caller, String assetId, BigInteger newRate) {
        lock.lock();
        try {
            reentrancyGuard.requireIdle("setInterestRate");
            InterestLedger ledger = requireMarket(assetId);
            BigInteger previous = ledger.setInterestRate(caller, newRate);

            outboxService.saveEvent(InterestRateUpdatedEvent.of(assetId, previous, newRate,
                    ledger.getIndex(), clock.instant()));
            ledgerMetrics.recordRateChange(assetId);
            return ledger.summary();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Deposit / Withdraw ====================

    /**
     * Pulls {@code amount} of the base asset from the caller and credits the
     * shares it buys at the current index.
     *
     * @throws LedgerException INVALID_AMOUNT, MARKET_NOT_FOUND,
     *         CUSTODY_TRANSFER_FAILED, REENTRANT_CALL
     */
    public PoolReceipt deposit(String caller, String assetId, BigInteger amount) {
        long startTime = System.currentTimeMillis();
        requirePositive(amount, "Deposit");
        requireCaller(caller);

        lock.lock();
        try (CorrelationContext.OperationScope ignored = CorrelationContext.forOperation(assetId, caller)) {
            reentrancyGuard.enter("deposit");
            try {
                InterestLedger ledger = requireMarket(assetId);

                pullFromCustody(assetId, caller, amount);

                BigInteger shares;
                try {
                    shares = ledger.mintShares(coordinatorId, caller, amount);
                } catch (RuntimeException e) {
                    refund(assetId, caller, amount, e);
                    throw e;
                }

                BigInteger index = ledger.getIndex();
                outboxService.saveEvent(DepositEvent.of(caller, assetId, amount, shares, index, clock.instant()));

                long duration = System.currentTimeMillis() - startTime;
                ledgerMetrics.recordDeposit(assetId, "success");
                ledgerMetrics.recordLatency("deposit", duration);

                log.info("Deposit completed: amount={}, shares={}, index={}, duration={}ms",
                        amount, shares, index, duration);
                return new PoolReceipt(assetId, caller, amount, shares, index, ledger.valueOf(caller));

            } catch (LedgerException e) {
                ledgerMetrics.recordDeposit(assetId, e.getErrorCode().name());
                log.warn("Deposit rejected: code={}, error={}", e.getErrorCode(), e.getMessage());
                throw e;
            } finally {
                reentrancyGuard.exit();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Burns the shares worth {@code amount} at the current index and pushes
     * {@code amount} of the base asset to the caller.
     *
     * Two checks guard the burn: the caller's value with interest must cover
     * {@code amount}, and the converted share count must not exceed the raw
     * shares held.
     *
     * @throws LedgerException INVALID_AMOUNT, MARKET_NOT_FOUND,
     *         INSUFFICIENT_BALANCE, INSUFFICIENT_SHARES,
     *         CUSTODY_TRANSFER_FAILED, REENTRANT_CALL
     */
    public PoolReceipt withdraw(String caller, String assetId, BigInteger amount) {
        long startTime = System.currentTimeMillis();
        requirePositive(amount, "Withdraw");
        requireCaller(caller);

        lock.lock();
        try (CorrelationContext.OperationScope ignored = CorrelationContext.forOperation(assetId, caller)) {
            reentrancyGuard.enter("withdraw");
            try {
                InterestLedger ledger = requireMarket(assetId);

                BigInteger available = ledger.valueOf(caller);
                if (available.compareTo(amount) < 0) {
                    throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
                            String.format("Insufficient balance: available=%s, requested=%s", available, amount));
                }

                LedgerCheckpoint checkpoint = ledger.checkpoint(caller);
                BigInteger index;
                BigInteger sharesToBurn;
                try {
                    index = ledger.advanceIndex();
                    sharesToBurn = FixedPointMath.valueToSharesUp(amount, index);
                    BigInteger held = ledger.sharesOf(caller);
                    if (sharesToBurn.compareTo(held) > 0) {
                        throw new LedgerException(LedgerErrorCode.INSUFFICIENT_SHARES,
                                String.format("Insufficient shares: held=%s, required=%s at index %s",
                                        held, sharesToBurn, index));
                    }
                    ledger.burnShares(coordinatorId, caller, sharesToBurn);
                    pushFromCustody(assetId, caller, amount);
                } catch (RuntimeException e) {
                    ledger.rollback(checkpoint);
                    throw e;
                }

                outboxService.saveEvent(WithdrawEvent.of(caller, assetId, amount, sharesToBurn, index, clock.instant()));

                long duration = System.currentTimeMillis() - startTime;
                ledgerMetrics.recordWithdrawal(assetId, "success");
                ledgerMetrics.recordLatency("withdraw", duration);

                log.info("Withdraw completed: amount={}, shares={}, index={}, duration={}ms",
                        amount, sharesToBurn, index, duration);
                return new PoolReceipt(assetId, caller, amount, sharesToBurn, index, ledger.valueOf(caller));

            } catch (LedgerException e) {
                ledgerMetrics.recordWithdrawal(assetId, e.getErrorCode().name());
                log.warn("Withdraw rejected: code={}, error={}", e.getErrorCode(), e.getMessage());
                throw e;
            } finally {
                reentrancyGuard.exit();
            }
        } finally {
            lock.unlock();
        }
    }

    // ==================== Queries ====================

    /**
     * The user's balance including interest up to now. Never writes.
     */
    public BigInteger getUserBalance(String assetId, String user) {
        lock.lock();
        try {
            return requireMarket(assetId).valueOf(user);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The user's raw principal shares.
     */
    public BigInteger getShareBalance(String assetId, String user) {
        lock.lock();
        try {
            return requireMarket(assetId).sharesOf(user);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Balance and shares from the same ledger state.
     */
    public HolderPosition getPosition(String assetId, String user) {
        lock.lock();
        try {
            InterestLedger ledger = requireMarket(assetId);
            return new HolderPosition(assetId, user, ledger.valueOf(user), ledger.sharesOf(user));
        } finally {
            lock.unlock();
        }
    }

    public MarketSummary getMarket(String assetId) {
        lock.lock();
        try {
            return requireMarket(assetId).summary();
        } finally {
            lock.unlock();
        }
    }

    public List<MarketSummary> listMarkets() {
        lock.lock();
        try {
            return markets.values().stream()
                    .map(InterestLedger::summary)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasMarket(String assetId) {
        lock.lock();
        try {
            return markets.containsKey(assetId);
        } finally {
            lock.unlock();
        }
    }

    public int marketCount() {
        lock.lock();
        try {
            return markets.size();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Helpers ====================

    private void pullFromCustody(String assetId, String from, BigInteger amount) {
        boolean moved;
        try {
            moved = custody.transferIn(assetId, from, amount);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Custody transfer in threw: assetId={}, from={}, amount={}", assetId, from, amount, e);
            throw new LedgerException(LedgerErrorCode.CUSTODY_TRANSFER_FAILED,
                    "Custody transfer in failed: " + e.getMessage(), e);
        }
        if (!moved) {
            log.error("Custody transfer in refused: assetId={}, from={}, amount={}", assetId, from, amount);
            throw new LedgerException(LedgerErrorCode.CUSTODY_TRANSFER_FAILED,
                    String.format("Custody could not transfer %s of %s from %s", amount, assetId, from));
        }
    }

    private void pushFromCustody(String assetId, String to, BigInteger amount) {
        boolean moved;
        try {
            moved = custody.transferOut(assetId, to, amount);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Custody transfer out threw: assetId={}, to={}, amount={}", assetId, to, amount, e);
            throw new LedgerException(LedgerErrorCode.CUSTODY_TRANSFER_FAILED,
                    "Custody transfer out failed: " + e.getMessage(), e);
        }
        if (!moved) {
            log.error("Custody transfer out refused: assetId={}, to={}, amount={}", assetId, to, amount);
            throw new LedgerException(LedgerErrorCode.CUSTODY_TRANSFER_FAILED,
                    String.format("Custody could not transfer %s of %s to %s", amount, assetId, to));
        }
    }

    /**
     * Returns funds already pulled for a deposit whose mint was rejected.
     */
    private void refund(String assetId, String to, BigInteger amount, RuntimeException cause) {
        boolean refunded;
        try {
            refunded = custody.transferOut(assetId, to, amount);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            refunded = false;
        }
        if (refunded) {
            log.warn("Deposit mint rejected, refunded {} to {}: {}", amount, to, cause.getMessage());
        } else {
            log.error("Deposit mint rejected and refund of {} to {} failed, manual reconciliation required",
                    amount, to, cause);
        }
    }

    private BigInteger previewIndex(InterestLedger ledger) {
        lock.lock();
        try {
            return ledger.previewIndex();
        } finally {
            lock.unlock();
        }
    }

    private InterestLedger requireMarket(String assetId) {
        InterestLedger ledger = markets.get(assetId);
        if (ledger == null) {
            throw LedgerException.marketNotFound(assetId);
        }
        return ledger;
    }

    private void requireAuthorized(String caller, LedgerOperation operation) {
        if (!authorizationPolicy.isAuthorized(caller, operation)) {
            throw LedgerException.unauthorized(caller, operation);
        }
    }

    private static void requirePositive(BigInteger amount, String operation) {
        if (!FixedPointMath.isPositive(amount)) {
            throw LedgerException.invalidAmount(operation + " amount must be greater than 0");
        }
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("Caller identity is required");
        }
    }

    private static void requireAssetId(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("Asset ID is required");
        }
    }
}
