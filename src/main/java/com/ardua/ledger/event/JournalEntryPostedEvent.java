package com.ardua.ledger.event;

import com.ardua.ledger.ledger.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A balanced journal entry was written, or had its lines rebuilt.
 */
@Value
public class JournalEntryPostedEvent implements LedgerEvent {
    UUID eventId;
    Long journalEntryId;
    String aggregateType;
    Long aggregateId;
    String description;
    String postedBy;
    BigDecimal amount;
    int lineCount;
    boolean linesReplaced;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalEntryPostedEvent posted(JournalEntry entry, Instant now) {
        return from(entry, false, now);
    }

    public static JournalEntryPostedEvent linesReplaced(JournalEntry entry, Instant now) {
        return from(entry, true, now);
    }

    private static JournalEntryPostedEvent from(JournalEntry entry, boolean replaced, Instant now) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            Aggregates.typeOf(entry),
            Aggregates.idOf(entry),
            entry.getDescription(),
            entry.getPostedBy(),
            entry.getTotalDebits(),
            entry.getLines().size(),
            replaced,
            now
        );
    }
}
