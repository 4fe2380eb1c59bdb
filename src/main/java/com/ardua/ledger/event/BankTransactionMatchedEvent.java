package com.ardua.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A bank transaction's link to a payment, expense or transfer counterpart changed.
 * {@code counterpartId} is null for {@link MatchKind#UNMATCHED}.
 */
@Value
public class BankTransactionMatchedEvent implements LedgerEvent {
    UUID eventId;
    Long bankTransactionId;
    MatchKind matchKind;
    Long counterpartId;
    Long journalEntryId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BankTransactionMatched";
    public static final String AGGREGATE_TYPE = "BANK_TRANSACTION";

    public enum MatchKind {
        PAYMENT,
        EXPENSE,
        TRANSFER,
        UNMATCHED
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public Long getAggregateId() {
        return bankTransactionId;
    }

    public static BankTransactionMatchedEvent of(Long bankTransactionId, MatchKind kind, Long counterpartId,
                                                 Long journalEntryId, Instant now) {
        return new BankTransactionMatchedEvent(
            UUID.randomUUID(), bankTransactionId, kind, counterpartId, journalEntryId, now);
    }
}
