package com.flagship.deposit_ledger.outbox;

import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.UUID;

/**
 * A serialized ledger event waiting to be relayed to Kafka.
 *
 * Immutable; a status change produces a copy that replaces this entry under
 * the same sequence number.
 */
@Value
public class OutboxEvent {
    UUID id;
    long sequenceNumber;
    String aggregateType;
    String aggregateId;        // asset ID, also the Kafka key
    String eventType;
    String payload;
    String correlationId;      // null when written outside a request
    Instant createdAt;
    @With
    Instant publishedAt;
    @With
    int retryCount;
    @With
    String lastError;

    static OutboxEvent pending(long sequenceNumber, String aggregateType, String aggregateId, String eventType,
                               String payload, String correlationId, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), sequenceNumber, aggregateType, aggregateId, eventType,
                payload, correlationId, createdAt, null, 0, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }

    OutboxEvent published(Instant at) {
        return withPublishedAt(at).withLastError(null);
    }

    OutboxEvent failed(String error) {
        return withRetryCount(retryCount + 1).withLastError(error);
    }
}
