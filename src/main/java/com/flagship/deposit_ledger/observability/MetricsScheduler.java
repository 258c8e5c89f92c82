package com.flagship.deposit_ledger.observability;

import com.flagship.deposit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Periodic housekeeping for observable state: refreshes outbox gauges and
 * drops relayed events past their retention.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final OutboxService outboxService;
    private final Clock clock;

    @Value("${outbox.retention:PT1H}")
    private Duration retention;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        int purged = outboxService.purgePublishedBefore(clock.instant().minus(retention));
        if (purged > 0) {
            log.debug("Purged {} published outbox events older than {}", purged, retention);
        }
        outboxMetrics.refreshMetrics();
    }
}
