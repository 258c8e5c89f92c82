package com.flagship.deposit_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigInteger;

/**
 * Deposit, withdraw and custody credit body. Amount is in base units.
 * Positivity is checked by the pool so the domain error code is returned.
 */
@Value
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;

    @JsonCreator
    public AmountRequest(@JsonProperty("amount") BigInteger amount) {
        this.amount = amount;
    }
}
