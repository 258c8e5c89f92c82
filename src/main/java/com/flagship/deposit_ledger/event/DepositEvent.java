package com.flagship.deposit_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when base asset has been pulled into custody and shares minted.
 */
@Value
public class DepositEvent implements LedgerEvent {
    UUID eventId;
    String user;
    String assetId;
    BigInteger amount;
    BigInteger sharesMinted;
    BigInteger index;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Deposit";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DepositEvent of(String user, String assetId, BigInteger amount,
                                  BigInteger sharesMinted, BigInteger index, Instant occurredAt) {
        return new DepositEvent(UUID.randomUUID(), user, assetId, amount, sharesMinted, index, occurredAt);
    }
}
