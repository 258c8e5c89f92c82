package com.flagship.deposit_ledger.market;

import java.math.BigInteger;

/**
 * Unsigned 1e18 fixed-point helpers shared by the ledger and the coordinator.
 *
 * All quantities are non-negative integers; BigInteger rules out overflow so
 * the only loss is the explicit rounding direction chosen at each call site.
 */
public final class FixedPointMath {

    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);
    public static final BigInteger INITIAL_INDEX = PRECISION;
    public static final BigInteger SECONDS_PER_YEAR = BigInteger.valueOf(365L * 24 * 60 * 60);

    private FixedPointMath() {
        // Utility class
    }

    /**
     * floor(a * b / denominator)
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        return a.multiply(b).divide(denominator);
    }

    /**
     * ceil(a * b / denominator)
     */
    public static BigInteger mulDivUp(BigInteger a, BigInteger b, BigInteger denominator) {
        BigInteger[] qr = a.multiply(b).divideAndRemainder(denominator);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    /**
     * Index growth over {@code elapsedSeconds} at an annual rate, using the
     * linear per-interval approximation:
     * {@code index * (PRECISION + rate * dt / SECONDS_PER_YEAR) / PRECISION}.
     */
    public static BigInteger accrue(BigInteger index, BigInteger annualRate, long elapsedSeconds) {
        if (elapsedSeconds <= 0) {
            return index;
        }
        BigInteger accumulatedRate = mulDiv(annualRate, BigInteger.valueOf(elapsedSeconds), SECONDS_PER_YEAR);
        return mulDiv(index, PRECISION.add(accumulatedRate), PRECISION);
    }

    /**
     * Principal shares to value at the given index, rounded down.
     */
    public static BigInteger sharesToValue(BigInteger shares, BigInteger index) {
        return mulDiv(shares, index, INITIAL_INDEX);
    }

    /**
     * Value to principal shares when crediting a holder, rounded down.
     */
    public static BigInteger valueToSharesDown(BigInteger value, BigInteger index) {
        return mulDiv(value, INITIAL_INDEX, index);
    }

    /**
     * Value to principal shares when debiting a holder, rounded up.
     */
    public static BigInteger valueToSharesUp(BigInteger value, BigInteger index) {
        return mulDivUp(value, INITIAL_INDEX, index);
    }

    public static boolean isPositive(BigInteger value) {
        return value != null && value.signum() > 0;
    }
}
