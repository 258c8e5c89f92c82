package com.flagship.deposit_ledger.observability;

import com.flagship.deposit_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Relay health of the ledger event outbox.
 *
 * Gauges hold the last values computed by {@link #refreshMetrics()} rather
 * than scanning the outbox on every scrape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    @PostConstruct
    public void init() {
        gauge("ledger.outbox.pending", "Ledger events not yet relayed to Kafka", pending);
        gauge("ledger.outbox.pending.age.seconds", "Seconds the oldest pending ledger event has waited",
                oldestPendingAgeSeconds);
        gauge("ledger.outbox.dead_letters", "Ledger events that used up their relay attempts", deadLettered);
    }

    public void refreshMetrics() {
        pending.set(outboxService.countUnpublished());
        oldestPendingAgeSeconds.set(outboxService.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                .orElse(0L));
        deadLettered.set(outboxService.countDeadLettered(maxRetries));

        log.debug("Outbox gauges: pending={}, oldestAge={}s, deadLetters={}",
                pending.get(), oldestPendingAgeSeconds.get(), deadLettered.get());
    }

    public long getBacklogSize() {
        return pending.get();
    }

    public long getDeadLetterCount() {
        return deadLettered.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("ledger.outbox.relayed", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("ledger.outbox.relayed", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("ledger.outbox.dead_lettered", "event_type", eventType).increment();
    }

    private void gauge(String name, String description, AtomicLong value) {
        Gauge.builder(name, value, AtomicLong::get)
                .description(description)
                .register(meterRegistry);
    }
}
