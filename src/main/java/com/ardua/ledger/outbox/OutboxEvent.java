package com.ardua.ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger event waiting in (or already relayed from) the outbox table.
 * Rows are written in the posting transaction and relayed to Kafka later by
 * {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // source document kind, e.g. "INVOICE"
    Long aggregateId;
    String eventType;          // e.g. "JournalEntryPosted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, Long aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Kafka record key. Keeps every event of one document on one partition.
     */
    public String partitionKey() {
        return aggregateType + ":" + aggregateId;
    }
}
