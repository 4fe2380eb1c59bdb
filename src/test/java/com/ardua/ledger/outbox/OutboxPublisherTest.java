package com.ardua.ledger.outbox;

import com.ardua.ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour against a mocked broker; no Kafka needed.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "ledger-events";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "ledgerEventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    @Test
    @DisplayName("Successful send is keyed by document and marks the event published")
    void publishesAndMarks() {
        // Given
        OutboxEvent event = event(0);
        when(outboxService.findUnpublishedEvents(10)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, "INVOICE:42", event.getPayload()))
            .thenReturn(CompletableFuture.completedFuture(sendResult(event)));

        // When
        publisher.publishPendingEvents();

        // Then
        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("JournalEntryPosted");
        verify(outboxService, never()).markFailed(any(), anyString());
    }

    @Test
    @DisplayName("Failed send records the error for a later retry")
    void failedSendMarksFailed() {
        OutboxEvent event = event(1);
        when(kafkaTemplate.send(TOPIC, "INVOICE:42", event.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishEvent(event);

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventPublishFailed("JournalEntryPosted");
        verify(outboxService, never()).markPublished(any());
    }

    @Test
    @DisplayName("Event at the retry ceiling is not sent again")
    void exhaustedEventIsLeftAlone() {
        OutboxEvent event = event(3);

        publisher.publishEvent(event);

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        verify(outboxMetrics).recordEventDeadLettered("JournalEntryPosted");
    }

    @Test
    @DisplayName("Read failure skips the cycle")
    void readFailureSkipsCycle() {
        when(outboxService.findUnpublishedEvents(10)).thenThrow(new IllegalStateException("db down"));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    private static OutboxEvent event(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "INVOICE", 42L, "JournalEntryPosted",
            "{\"journalEntryId\":1}", Instant.now(), null, retryCount, null);
    }

    private static SendResult<String, String> sendResult(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, event.partitionKey(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return new SendResult<>(record, metadata);
    }
}
