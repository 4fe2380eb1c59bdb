package com.ardua.ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One debit or credit row of a journal entry. Both columns are non-negative;
 * normal postings fill exactly one of them.
 */
@Value
public class JournalLine {
    Long id;
    Long entryId;
    Long accountId;
    BigDecimal debit;
    BigDecimal credit;
}
