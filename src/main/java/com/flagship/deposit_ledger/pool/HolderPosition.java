package com.flagship.deposit_ledger.pool;

import lombok.Value;

import java.math.BigInteger;

/**
 * A holder's value with interest and the raw shares behind it, read together.
 */
@Value
public class HolderPosition {
    String assetId;
    String user;
    BigInteger balance;
    BigInteger shares;
}
