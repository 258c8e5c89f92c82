package com.flagship.deposit_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.deposit_ledger.pool.PoolReceipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class ReceiptResponse {

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("user")
    String user;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("shares")
    BigInteger shares;

    @JsonProperty("index")
    BigInteger index;

    @JsonProperty("balance")
    BigInteger balance;

    public static ReceiptResponse from(PoolReceipt receipt) {
        return ReceiptResponse.builder()
            .assetId(receipt.getAssetId())
            .user(receipt.getUser())
            .amount(receipt.getAmount())
            .shares(receipt.getShares())
            .index(receipt.getIndex())
            .balance(receipt.getBalance())
            .build();
    }
}
