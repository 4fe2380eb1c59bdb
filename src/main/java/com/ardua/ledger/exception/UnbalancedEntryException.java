package com.ardua.ledger.exception;

import java.math.BigDecimal;

/**
 * Internal invariant violation: a journal entry's debits and credits differ.
 * Posting code builds entries that always balance, so this is a programming
 * error and is never mapped to a user-facing message.
 */
public class UnbalancedEntryException extends IllegalStateException {

    public UnbalancedEntryException(BigDecimal debits, BigDecimal credits) {
        super(String.format("Journal entry is not balanced: debits=%s, credits=%s", debits, credits));
    }
}
