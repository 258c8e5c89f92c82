package com.flagship.deposit_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.deposit_ledger.event.LedgerEvent;
import com.flagship.deposit_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Ordered, in-process outbox of ledger events.
 *
 * The pool coordinator appends an event as the last step of a successful
 * operation, inside its serialized section, so an aborted operation never
 * leaves an event behind. Nothing is sent from here; the
 * {@link OutboxPublisher} drains entries in sequence order.
 *
 * Only relayed entries are ever purged. Dead letters stay until an operator
 * deals with them, and with the relay disabled every entry stays, so the map
 * grows without bound in that mode. The outbox health indicator reports DOWN
 * on either condition.
 */
@Service
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_TYPE = "Market";

    private final ConcurrentSkipListMap<Long, OutboxEvent> events = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxService(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Serializes the event and appends it under the next sequence number,
     * stamped with the current correlation ID.
     */
    public OutboxEvent saveEvent(LedgerEvent event) {
        OutboxEvent entry = OutboxEvent.pending(sequence.incrementAndGet(), AGGREGATE_TYPE,
                event.getAssetId(), event.getEventType(), toJson(event),
                CorrelationContext.currentCorrelationId(), clock.instant());
        events.put(entry.getSequenceNumber(), entry);

        log.debug("Outbox append: seq={}, type={}, assetId={}",
                entry.getSequenceNumber(), entry.getEventType(), entry.getAggregateId());
        return entry;
    }

    /**
     * Oldest pending events first. Dead letters are skipped so they cannot
     * hold back the rest of the backlog.
     */
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return events.values().stream()
                .filter(e -> !e.isPublished() && !e.isDeadLetter(maxRetries))
                .limit(limit)
                .toList();
    }

    public void markPublished(UUID eventId) {
        replace(eventId, e -> e.published(clock.instant()));
    }

    public void markFailed(UUID eventId, String errorMessage) {
        replace(eventId, e -> e.failed(errorMessage))
                .ifPresent(e -> log.warn("Outbox relay failed: eventId={}, attempt={}, error={}",
                        eventId, e.getRetryCount(), errorMessage));
    }

    /**
     * Every entry still held for a market, in sequence order.
     */
    public List<OutboxEvent> getEventsForAggregate(String assetId) {
        return events.values().stream()
                .filter(e -> e.getAggregateId().equals(assetId))
                .toList();
    }

    public long countUnpublished() {
        return events.values().stream().filter(e -> !e.isPublished()).count();
    }

    public long countDeadLettered(int maxRetries) {
        return events.values().stream().filter(e -> e.isDeadLetter(maxRetries)).count();
    }

    /**
     * Drops relayed entries created before the cutoff. Pending entries and
     * dead letters are kept whatever their age.
     *
     * @return number of entries removed
     */
    public int purgePublishedBefore(Instant cutoff) {
        int removed = 0;
        for (OutboxEvent e : events.values()) {
            if (e.isPublished() && e.getCreatedAt().isBefore(cutoff)
                    && events.remove(e.getSequenceNumber(), e)) {
                removed++;
            }
        }
        return removed;
    }

    public Optional<Instant> findOldestUnpublishedCreatedAt() {
        return events.values().stream()
                .filter(e -> !e.isPublished())
                .map(OutboxEvent::getCreatedAt)
                .findFirst();
    }

    private Optional<OutboxEvent> replace(UUID eventId, UnaryOperator<OutboxEvent> change) {
        Optional<OutboxEvent> current = events.values().stream()
                .filter(e -> e.getId().equals(eventId))
                .findFirst();
        if (current.isEmpty()) {
            log.warn("Outbox entry not found: eventId={}", eventId);
            return Optional.empty();
        }
        OutboxEvent updated = change.apply(current.get());
        events.put(updated.getSequenceNumber(), updated);
        return Optional.of(updated);
    }

    private String toJson(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " event", e);
        }
    }
}
