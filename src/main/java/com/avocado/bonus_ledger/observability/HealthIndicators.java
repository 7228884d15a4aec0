package com.avocado.bonus_ledger.observability;

import com.avocado.bonus_ledger.bonus.BonusPostingFailureRecorder;
import com.avocado.bonus_ledger.outbox.OutboxEventRepository;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator health contributions for the outbox and the engine hooks.
 */
public class HealthIndicators {

    /**
     * DOWN once the notification backlog reaches the limit, which means the publisher
     * has stopped draining the outbox. Events past the retry limit are reported but do
     * not change the status.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_LIMIT = 5000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long pending = outboxRepository.countPending();
                long stuck = outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
                Health.Builder builder = pending < BACKLOG_LIMIT ? Health.up() : Health.down();
                return builder
                        .withDetail("pending", pending)
                        .withDetail("pastRetryLimit", stuck)
                        .withDetail("backlogLimit", BACKLOG_LIMIT)
                        .build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Reports which engine hooks are switched on and how many automatic postings
     * are waiting for repair. A disabled hook is DEGRADED: sales are still recorded
     * but their bonus or discount will not follow until the hook is enabled again.
     */
    @Component("engineHooksHealth")
    public static class EngineHooksHealthIndicator implements HealthIndicator {

        private final EngineHookRegistry hookRegistry;
        private final BonusPostingFailureRecorder failureRecorder;

        public EngineHooksHealthIndicator(EngineHookRegistry hookRegistry,
                                          BonusPostingFailureRecorder failureRecorder) {
            this.hookRegistry = hookRegistry;
            this.failureRecorder = failureRecorder;
        }

        @Override
        public Health health() {
            try {
                Map<EngineHook, Boolean> statuses = hookRegistry.statuses();
                boolean allEnabled = statuses.values().stream().allMatch(Boolean::booleanValue);

                Health.Builder builder = allEnabled ? Health.up() : Health.status("DEGRADED");
                statuses.forEach((hook, enabled) -> builder.withDetail(hook.name(), enabled));
                return builder
                        .withDetail("unresolvedPostingFailures", failureRecorder.countUnresolved())
                        .build();

            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }
}
