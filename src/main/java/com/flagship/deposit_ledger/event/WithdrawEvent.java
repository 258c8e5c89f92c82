package com.flagship.deposit_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when shares have been burned and the base asset pushed out of custody.
 */
@Value
public class WithdrawEvent implements LedgerEvent {
    UUID eventId;
    String user;
    String assetId;
    BigInteger amount;
    BigInteger sharesBurned;
    BigInteger index;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Withdraw";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WithdrawEvent of(String user, String assetId, BigInteger amount,
                                   BigInteger sharesBurned, BigInteger index, Instant occurredAt) {
        return new WithdrawEvent(UUID.randomUUID(), user, assetId, amount, sharesBurned, index, occurredAt);
    }
}
