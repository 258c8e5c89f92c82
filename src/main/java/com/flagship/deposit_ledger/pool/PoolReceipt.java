package com.flagship.deposit_ledger.pool;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a deposit or withdraw.
 *
 * {@code shares} is the principal minted or burned; {@code index} is the
 * index the conversion used; {@code balance} is the holder's value with
 * interest right after the operation.
 */
@Value
public class PoolReceipt {
    String assetId;
    String user;
    BigInteger amount;
    BigInteger shares;
    BigInteger index;
    BigInteger balance;
}
