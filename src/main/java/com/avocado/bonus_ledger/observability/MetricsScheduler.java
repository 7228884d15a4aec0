package com.avocado.bonus_ledger.observability;

import com.avocado.bonus_ledger.bonus.BonusPostingFailureRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final BonusMetrics bonusMetrics;
    private final BonusPostingFailureRecorder failureRecorder;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshPostingFailureBacklog() {
        try {
            bonusMetrics.updateUnresolvedFailures(failureRecorder.countUnresolved());
        } catch (Exception e) {
            log.warn("Failed to refresh bonus posting failure backlog: {}", e.getMessage());
        }
    }
}
