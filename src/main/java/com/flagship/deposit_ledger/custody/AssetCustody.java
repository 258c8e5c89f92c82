package com.flagship.deposit_ledger.custody;

import java.math.BigInteger;

/**
 * External custody of the base assets backing each market.
 *
 * A {@code false} result means the movement did not happen; the pool aborts
 * the enclosing operation.
 */
public interface AssetCustody {

    /**
     * Moves {@code amount} of the asset from the holder into pool custody.
     */
    boolean transferIn(String assetId, String from, BigInteger amount);

    /**
     * Moves {@code amount} of the asset out of pool custody to the holder.
     */
    boolean transferOut(String assetId, String to, BigInteger amount);

    /**
     * Amount of the asset the holder has outside the pool.
     */
    BigInteger balanceOf(String assetId, String holder);

    /**
     * Amount of the asset held by the pool.
     */
    BigInteger poolBalance(String assetId);
}
