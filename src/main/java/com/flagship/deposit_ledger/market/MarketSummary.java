package com.flagship.deposit_ledger.market;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read-only view of a market, with index and totals previewed to the query time.
 */
@Value
@Builder
public class MarketSummary {

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("annual_interest_rate")
    BigInteger annualInterestRate;

    @JsonProperty("index")
    BigInteger index;

    @JsonProperty("last_update")
    Instant lastUpdate;

    @JsonProperty("total_shares")
    BigInteger totalShares;

    @JsonProperty("total_value")
    BigInteger totalValue;
}
