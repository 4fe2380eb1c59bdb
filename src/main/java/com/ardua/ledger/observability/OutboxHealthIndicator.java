package com.ardua.ledger.observability;

import com.ardua.ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when the outbox backlog reaches the critical threshold,
 * WARNING above the warning threshold.
 */
@Component("outboxHealth")
public class OutboxHealthIndicator implements HealthIndicator {

    private static final long BACKLOG_WARNING_THRESHOLD = 1000;
    private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

    private final OutboxEventRepository outboxRepository;

    public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
        this.outboxRepository = outboxRepository;
    }

    @Override
    public Health health() {
        try {
            long backlogSize = outboxRepository.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();

        } catch (RuntimeException e) {
            return Health.down(e).build();
        }
    }
}
