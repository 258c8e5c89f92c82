package com.flagship.deposit_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events.
 *
 * All events share these common properties:
 * - Event ID for deduplication
 * - Asset ID of the market (aggregate ID)
 * - Timestamp of when the event occurred
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * The market this event is about.
     */
    String getAssetId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
