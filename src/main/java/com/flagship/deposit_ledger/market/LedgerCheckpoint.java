package com.flagship.deposit_ledger.market;

import lombok.Value;

import java.math.BigInteger;

/**
 * Captured ledger state for one holder, restored when an operation that has
 * already touched the ledger must abort. The rate is not captured: it only
 * changes through an explicit, separately committed rate update.
 */
@Value
public class LedgerCheckpoint {
    String assetId;
    String holder;
    BigInteger index;
    long lastUpdateTimestamp;
    BigInteger holderShares;
    BigInteger totalShares;
}
