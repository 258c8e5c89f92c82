package com.flagship.deposit_ledger.observability;

import com.flagship.deposit_ledger.market.MarketSummary;
import com.flagship.deposit_ledger.outbox.OutboxService;
import com.flagship.deposit_ledger.pool.PoolCoordinator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator health contributors for the deposit ledger.
 */
public class HealthIndicators {

    /**
     * DOWN once the relay backlog or the dead letters pass their limits.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_LIMIT = 10_000;

        private final OutboxService outboxService;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxService outboxService,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxService = outboxService;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            long pending = outboxService.countUnpublished();
            long deadLetters = outboxService.countDeadLettered(maxRetries);

            Health.Builder builder = pending >= BACKLOG_LIMIT || deadLetters > 0 ? Health.down() : Health.up();
            return builder
                    .withDetail("pending", pending)
                    .withDetail("deadLetters", deadLetters)
                    .withDetail("backlogLimit", BACKLOG_LIMIT)
                    .build();
        }
    }

    /**
     * Reports each market's previewed index and total principal.
     */
    @Component("marketsHealth")
    public static class MarketsHealthIndicator implements HealthIndicator {

        private final PoolCoordinator poolCoordinator;

        public MarketsHealthIndicator(PoolCoordinator poolCoordinator) {
            this.poolCoordinator = poolCoordinator;
        }

        @Override
        public Health health() {
            Map<String, Object> markets = new LinkedHashMap<>();
            for (MarketSummary market : poolCoordinator.listMarkets()) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("index", market.getIndex().toString());
                detail.put("rate", market.getAnnualInterestRate().toString());
                detail.put("totalShares", market.getTotalShares().toString());
                markets.put(market.getAssetId(), detail);
            }
            return Health.up().withDetail("count", markets.size()).withDetail("markets", markets).build();
        }
    }

    /**
     * Producer connectivity, only registered while the relay runs.
     */
    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                int producerMetrics = kafkaTemplate.metrics().size();
                return producerMetrics == 0
                        ? Health.down().withDetail("error", "Producer not connected").build()
                        : Health.up().withDetail("producerMetrics", producerMetrics).build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }
}
