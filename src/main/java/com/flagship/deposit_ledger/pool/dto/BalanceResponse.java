package com.flagship.deposit_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.deposit_ledger.pool.HolderPosition;
import lombok.Value;

import java.math.BigInteger;

/**
 * A holder's position: value with interest and the raw principal behind it.
 */
@Value
public class BalanceResponse {

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("user")
    String user;

    @JsonProperty("balance")
    BigInteger balance;

    @JsonProperty("shares")
    BigInteger shares;

    public static BalanceResponse from(HolderPosition position) {
        return new BalanceResponse(position.getAssetId(), position.getUser(),
                position.getBalance(), position.getShares());
    }
}
