package com.flagship.deposit_ledger.market;

import com.flagship.deposit_ledger.auth.AuthorizationPolicy;
import com.flagship.deposit_ledger.auth.LedgerOperation;
import com.flagship.deposit_ledger.exception.LedgerErrorCode;
import com.flagship.deposit_ledger.exception.LedgerException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Interest accrual ledger for one asset market.
 *
 * Holds a single global index that starts at {@link FixedPointMath#INITIAL_INDEX}
 * and grows with elapsed time at the current annual rate. Holders own raw
 * principal shares; interest is applied only when a share balance is read,
 * as {@code shares * index / INITIAL_INDEX}.
 *
 * Key invariants:
 * - The index never decreases (rates are non-negative)
 * - lastUpdateTimestamp never moves backwards and never exceeds the clock
 * - Advancing twice in the same second is a no-op
 * - Every mutation advances the index first, so the rate in force before the
 *   call is settled up to now
 *
 * Advancement is lazy: there is no timer, only the next state-changing call
 * or an on-demand {@link #previewIndex()}.
 *
 * Not thread-safe. The owning {@code PoolCoordinator} serializes all calls.
 */
@Slf4j
public class InterestLedger {

    @Getter
    private final String underlyingAssetId;
    @Getter
    private final String name;
    @Getter
    private final String symbol;

    private final AuthorizationPolicy authorizationPolicy;
    private final Clock clock;

    private final Map<String, BigInteger> principalShares = new HashMap<>();
    private BigInteger totalShares = BigInteger.ZERO;

    private BigInteger annualInterestRate;
    private BigInteger index;
    private long lastUpdateTimestamp;

    public InterestLedger(String underlyingAssetId, LedgerConfig config,
                          AuthorizationPolicy authorizationPolicy, Clock clock) {
        if (underlyingAssetId == null || underlyingAssetId.isBlank()) {
            throw new IllegalArgumentException("Underlying asset ID is required");
        }
        if (config == null) {
            throw new IllegalArgumentException("Ledger config is required");
        }
        requireValidRate(config.getInitialRate());
        this.underlyingAssetId = underlyingAssetId;
        this.name = config.getName();
        this.symbol = config.getSymbol();
        this.authorizationPolicy = authorizationPolicy;
        this.clock = clock;
        this.annualInterestRate = config.getInitialRate();
        this.index = FixedPointMath.INITIAL_INDEX;
        this.lastUpdateTimestamp = now();
    }

    // ==================== Index ====================

    /**
     * Brings the stored index up to the current second.
     *
     * @return the index after advancement
     */
    public BigInteger advanceIndex() {
        return advanceTo(now());
    }

    private BigInteger advanceTo(long now) {
        long elapsed = now - lastUpdateTimestamp;
        if (elapsed <= 0) {
            if (elapsed < 0) {
                log.warn("Clock is behind last index update, skipping advancement: assetId={}, lastUpdate={}, now={}",
                        underlyingAssetId, lastUpdateTimestamp, now);
            }
            return index;
        }

        BigInteger previous = index;
        index = FixedPointMath.accrue(index, annualInterestRate, elapsed);
        lastUpdateTimestamp = now;

        log.debug("Advanced index: assetId={}, elapsed={}s, from={}, to={}",
                underlyingAssetId, elapsed, previous, index);
        return index;
    }

    /**
     * What {@link #advanceIndex()} would produce right now, without writing.
     */
    public BigInteger previewIndex() {
        return previewAt(now());
    }

    private BigInteger previewAt(long now) {
        return FixedPointMath.accrue(index, annualInterestRate, now - lastUpdateTimestamp);
    }

    /**
     * The stored index as of {@link #getLastUpdateTimestamp()}.
     */
    public BigInteger getIndex() {
        return index;
    }

    public long getLastUpdateTimestamp() {
        return lastUpdateTimestamp;
    }

    public BigInteger getAnnualInterestRate() {
        return annualInterestRate;
    }

    // ==================== Balances ====================

    /**
     * Balance including interest accrued up to now.
     */
    public BigInteger valueOf(String holder) {
        return FixedPointMath.sharesToValue(sharesOf(holder), previewIndex());
    }

    /**
     * Raw principal shares, unaffected by interest.
     */
    public BigInteger sharesOf(String holder) {
        return principalShares.getOrDefault(holder, BigInteger.ZERO);
    }

    public BigInteger totalShares() {
        return totalShares;
    }

    /**
     * All principal valued at the previewed index.
     */
    public BigInteger totalValue() {
        return FixedPointMath.sharesToValue(totalShares, previewIndex());
    }

    // ==================== Mutations ====================

    /**
     * Credits the holder with the shares that {@code valueAmount} buys at the
     * freshly advanced index, rounded down.
     *
     * @param caller identity making the call, must hold MINT_SHARES
     * @param holder recipient of the shares
     * @param valueAmount value to convert into shares
     * @return number of shares minted
     * @throws LedgerException UNAUTHORIZED, or INVALID_AMOUNT if the value is
     *         not positive or too small to buy a single share
     */
    public BigInteger mintShares(String caller, String holder, BigInteger valueAmount) {
        requireAuthorized(caller, LedgerOperation.MINT_SHARES);
        requireHolder(holder);
        if (!FixedPointMath.isPositive(valueAmount)) {
            throw LedgerException.invalidAmount("Mint amount must be greater than 0");
        }

        long now = now();
        BigInteger freshIndex = previewAt(now);
        BigInteger shares = FixedPointMath.valueToSharesDown(valueAmount, freshIndex);
        if (shares.signum() == 0) {
            throw LedgerException.invalidAmount(
                    String.format("Amount %s is too small to mint a share at index %s", valueAmount, freshIndex));
        }

        advanceTo(now);
        principalShares.merge(holder, shares, BigInteger::add);
        totalShares = totalShares.add(shares);

        log.debug("Minted shares: assetId={}, holder={}, value={}, shares={}, index={}",
                underlyingAssetId, holder, valueAmount, shares, index);
        return shares;
    }

    /**
     * Removes raw principal shares from the holder.
     *
     * @param caller identity making the call, must hold BURN_SHARES
     * @param holder owner of the shares
     * @param shareAmount shares to destroy
     * @throws LedgerException UNAUTHORIZED, INVALID_AMOUNT if not positive,
     *         INSUFFICIENT_SHARES if the holder owns fewer shares
     */
    public void burnShares(String caller, String holder, BigInteger shareAmount) {
        requireAuthorized(caller, LedgerOperation.BURN_SHARES);
        requireHolder(holder);
        if (!FixedPointMath.isPositive(shareAmount)) {
            throw LedgerException.invalidAmount("Burn amount must be greater than 0");
        }
        BigInteger held = sharesOf(holder);
        if (shareAmount.compareTo(held) > 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_SHARES,
                    String.format("Insufficient shares: holder=%s, held=%s, requested=%s",
                            holder, held, shareAmount));
        }

        advanceIndex();
        BigInteger remaining = held.subtract(shareAmount);
        if (remaining.signum() == 0) {
            principalShares.remove(holder);
        } else {
            principalShares.put(holder, remaining);
        }
        totalShares = totalShares.subtract(shareAmount);

        log.debug("Burned shares: assetId={}, holder={}, shares={}, index={}",
                underlyingAssetId, holder, shareAmount, index);
    }

    /**
     * Settles the current rate up to now, then switches to {@code newRate}.
     * A zero rate pauses accrual.
     *
     * @return the rate that was replaced
     */
    public BigInteger setInterestRate(String caller, BigInteger newRate) {
        requireAuthorized(caller, LedgerOperation.SET_INTEREST_RATE);
        requireValidRate(newRate);

        advanceIndex();
        BigInteger previous = annualInterestRate;
        annualInterestRate = newRate;

        log.info("Interest rate updated: assetId={}, from={}, to={}, index={}",
                underlyingAssetId, previous, newRate, index);
        return previous;
    }

    // ==================== Checkpoints ====================

    public LedgerCheckpoint checkpoint(String holder) {
        return new LedgerCheckpoint(
                underlyingAssetId,
                holder,
                index,
                lastUpdateTimestamp,
                sharesOf(holder),
                totalShares
        );
    }

    /**
     * Restores the state captured by {@link #checkpoint(String)}. Only the
     * checkpointed holder's shares are restored; the caller must not have
     * touched any other holder since.
     */
    public void rollback(LedgerCheckpoint checkpoint) {
        if (!underlyingAssetId.equals(checkpoint.getAssetId())) {
            throw new IllegalArgumentException(
                    "Checkpoint belongs to market " + checkpoint.getAssetId() + ", not " + underlyingAssetId);
        }
        index = checkpoint.getIndex();
        lastUpdateTimestamp = checkpoint.getLastUpdateTimestamp();
        totalShares = checkpoint.getTotalShares();
        if (checkpoint.getHolderShares().signum() == 0) {
            principalShares.remove(checkpoint.getHolder());
        } else {
            principalShares.put(checkpoint.getHolder(), checkpoint.getHolderShares());
        }
        log.warn("Rolled back ledger state: assetId={}, holder={}", underlyingAssetId, checkpoint.getHolder());
    }

    public MarketSummary summary() {
        return MarketSummary.builder()
                .assetId(underlyingAssetId)
                .name(name)
                .symbol(symbol)
                .annualInterestRate(annualInterestRate)
                .index(previewIndex())
                .lastUpdate(Instant.ofEpochSecond(lastUpdateTimestamp))
                .totalShares(totalShares)
                .totalValue(totalValue())
                .build();
    }

    // ==================== Helpers ====================

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private void requireAuthorized(String caller, LedgerOperation operation) {
        if (!authorizationPolicy.isAuthorized(caller, operation)) {
            throw LedgerException.unauthorized(caller, operation);
        }
    }

    private static void requireHolder(String holder) {
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Holder is required");
        }
    }

    private static void requireValidRate(BigInteger rate) {
        if (rate == null || rate.signum() < 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_INTEREST_RATE,
                    "Interest rate must be zero or positive: " + rate);
        }
    }
}
