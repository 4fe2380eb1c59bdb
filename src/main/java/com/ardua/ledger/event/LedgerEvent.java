package com.ardua.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact emitted by the posting engine. Written to the outbox in the same
 * transaction as the journal rows it describes.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Document kind used as outbox aggregate type and Kafka key prefix.
     */
    String getAggregateType();

    Long getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
