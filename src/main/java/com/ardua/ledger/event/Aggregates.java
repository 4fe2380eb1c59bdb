package com.ardua.ledger.event;

import com.ardua.ledger.ledger.JournalEntry;

/**
 * Entries are keyed by their source document so a consumer sees one
 * document's postings in order. Manual entries fall back to the entry itself.
 */
final class Aggregates {

    static final String JOURNAL_ENTRY = "JOURNAL_ENTRY";

    private Aggregates() {
    }

    static String typeOf(JournalEntry entry) {
        return entry.getSource() != null ? entry.getSource().getType().name() : JOURNAL_ENTRY;
    }

    static Long idOf(JournalEntry entry) {
        return entry.getSource() != null ? entry.getSource().getId() : entry.getId();
    }
}
