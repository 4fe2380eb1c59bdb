package com.ardua.ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Sum of every debit and every credit in the journal.
 */
@Value
public class JournalTotals {
    BigDecimal debits;
    BigDecimal credits;

    public boolean isBalanced() {
        return debits.compareTo(credits) == 0;
    }
}
