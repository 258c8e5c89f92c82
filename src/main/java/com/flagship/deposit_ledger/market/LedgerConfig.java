package com.flagship.deposit_ledger.market;

import lombok.Value;

import java.math.BigInteger;

/**
 * Parameters for a new market's ledger.
 *
 * {@code initialRate} is annualized and 1e18-scaled: 1e17 is 10% per year.
 */
@Value
public class LedgerConfig {
    String name;
    String symbol;
    BigInteger initialRate;

    public static LedgerConfig of(String name, String symbol, BigInteger initialRate) {
        return new LedgerConfig(name, symbol, initialRate);
    }
}
