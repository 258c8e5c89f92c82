package com.flagship.deposit_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

@Value
public class InterestRateRequest {

    @NotNull(message = "Rate is required")
    @PositiveOrZero(message = "Rate must not be negative")
    @JsonProperty("rate")
    BigInteger rate;

    @JsonCreator
    public InterestRateRequest(@JsonProperty("rate") BigInteger rate) {
        this.rate = rate;
    }
}
