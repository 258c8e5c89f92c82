package com.flagship.deposit_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

@Value
public class InitializeMarketRequest {

    @NotBlank(message = "Asset ID is required")
    @JsonProperty("asset_id")
    String assetId;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Symbol is required")
    @JsonProperty("symbol")
    String symbol;

    /**
     * Annual rate scaled by 1e18.
     */
    @NotNull(message = "Initial rate is required")
    @PositiveOrZero(message = "Initial rate must not be negative")
    @JsonProperty("initial_rate")
    BigInteger initialRate;

    @JsonCreator
    public InitializeMarketRequest(@JsonProperty("asset_id") String assetId,
                                   @JsonProperty("name") String name,
                                   @JsonProperty("symbol") String symbol,
                                   @JsonProperty("initial_rate") BigInteger initialRate) {
        this.assetId = assetId;
        this.name = name;
        this.symbol = symbol;
        this.initialRate = initialRate;
    }
}
