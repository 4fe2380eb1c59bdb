package com.ardua.ledger.outbox;

import com.ardua.ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Relays outbox rows to the ledger events topic.
 *
 * Sends are synchronous so a document's events keep their order on the
 * partition picked by {@link OutboxEvent#partitionKey()}. A failed send bumps
 * the retry count; once it reaches {@code outbox.publisher.max-retries} the
 * event is left for manual handling.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findUnpublishedEvents(batchSize);
        } catch (RuntimeException e) {
            log.error("Error reading unpublished outbox events", e);
            return;
        }

        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} unpublished events to process", events.size());

        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    void publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Event {} exceeded max retries ({}), leaving it for manual handling. eventType={}, key={}",
                    event.getId(), maxRetries, event.getEventType(), event.partitionKey());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            return;
        }

        try {
            SendResult<String, String> result =
                    kafkaTemplate.send(ledgerEventsTopic, event.partitionKey(), event.getPayload()).get();

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        }
    }
}
