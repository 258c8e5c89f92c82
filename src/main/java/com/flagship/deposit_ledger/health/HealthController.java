package com.flagship.deposit_ledger.health;

import com.flagship.deposit_ledger.observability.OutboxMetrics;
import com.flagship.deposit_ledger.pool.PoolCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe. Answers without touching Kafka; outbox figures are the
 * values from the last metrics refresh.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final PoolCoordinator poolCoordinator;
    private final OutboxMetrics outboxMetrics;
    private final Clock clock;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());
        response.put("markets", poolCoordinator.marketCount());
        response.put("outbox_pending", outboxMetrics.getBacklogSize());
        response.put("outbox_dead_letters", outboxMetrics.getDeadLetterCount());
        return response;
    }
}
