package com.ardua.ledger.event;

import com.ardua.ledger.ledger.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A journal entry was deleted because its posting was superseded
 * (retag, rematch or unmatch of a bank transaction).
 */
@Value
public class JournalEntryRemovedEvent implements LedgerEvent {
    UUID eventId;
    Long journalEntryId;
    String aggregateType;
    Long aggregateId;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryRemoved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalEntryRemovedEvent of(JournalEntry entry, Instant now) {
        return new JournalEntryRemovedEvent(
            UUID.randomUUID(),
            entry.getId(),
            Aggregates.typeOf(entry),
            Aggregates.idOf(entry),
            entry.getTotalDebits(),
            now
        );
    }
}
