package com.flagship.deposit_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class MarketInitializedEvent implements LedgerEvent {
    UUID eventId;
    String assetId;
    String name;
    String symbol;
    BigInteger initialRate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MarketInitialized";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MarketInitializedEvent of(String assetId, String name, String symbol,
                                            BigInteger initialRate, Instant occurredAt) {
        return new MarketInitializedEvent(UUID.randomUUID(), assetId, name, symbol, initialRate, occurredAt);
    }
}
