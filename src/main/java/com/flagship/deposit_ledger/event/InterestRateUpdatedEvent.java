package com.flagship.deposit_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published after the old rate was settled into the index and the new rate took effect.
 */
@Value
public class InterestRateUpdatedEvent implements LedgerEvent {
    UUID eventId;
    String assetId;
    BigInteger previousRate;
    BigInteger newRate;
    BigInteger index;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InterestRateUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InterestRateUpdatedEvent of(String assetId, BigInteger previousRate, BigInteger newRate,
                                              BigInteger index, Instant occurredAt) {
        return new InterestRateUpdatedEvent(UUID.randomUUID(), assetId, previousRate, newRate, index, occurredAt);
    }
}
