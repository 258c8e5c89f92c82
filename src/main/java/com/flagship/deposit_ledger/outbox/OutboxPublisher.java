package com.flagship.deposit_ledger.outbox;

import com.flagship.deposit_ledger.observability.CorrelationContext;
import com.flagship.deposit_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Relays outbox entries to the ledger topic.
 *
 * Entries are sent one at a time in sequence order, keyed by asset ID, and
 * marked published only after the broker acknowledges. A failed send counts
 * against the entry's retries; once they are used up the entry stays in the
 * outbox as a dead letter and is no longer picked up.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    public static final String EVENT_TYPE_HEADER = "event-type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger:ledger-events}")
    private String ledgerTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        if (batch.isEmpty()) {
            return;
        }
        log.debug("Relaying {} outbox entries to {}", batch.size(), ledgerTopic);

        for (OutboxEvent event : batch) {
            if (!relay(event)) {
                // keep per-market order: later entries wait for the next poll
                break;
            }
        }
    }

    /**
     * Runs one relay pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    private boolean relay(OutboxEvent event) {
        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event)).get().getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

            log.debug("Relayed seq={} type={} to {}-{}@{}", event.getSequenceNumber(), event.getEventType(),
                    metadata.topic(), metadata.partition(), metadata.offset());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(event, cause.getClass().getSimpleName() + ": " + cause.getMessage());
            return false;
        } catch (RuntimeException e) {
            recordFailure(event, e.getClass().getSimpleName() + ": " + e.getMessage());
            return false;
        }
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(ledgerTopic, event.getAggregateId(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Relay failed: seq={}, eventId={}, type={}, assetId={}, error={}",
                event.getSequenceNumber(), event.getId(), event.getEventType(), event.getAggregateId(), error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Outbox entry dead-lettered after {} attempts: eventId={}, type={}, assetId={}",
                    maxRetries, event.getId(), event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
