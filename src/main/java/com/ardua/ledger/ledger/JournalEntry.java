package com.ardua.ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One atomic accounting event as read back from the journal.
 */
@Value
public class JournalEntry {

    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    Long id;
    LocalDateTime postedAt;
    String postedBy;
    String description;
    SourceReference source;
    List<JournalLine> lines;

    public BigDecimal getTotalDebits() {
        return lines.stream()
            .map(JournalLine::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalCredits() {
        return lines.stream()
            .map(JournalLine::getCredit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return getTotalDebits().compareTo(getTotalCredits()) == 0;
    }

    /**
     * Sum of debits posted to the given account by this entry.
     */
    public BigDecimal debitsTo(Long accountId) {
        return lines.stream()
            .filter(line -> line.getAccountId().equals(accountId))
            .map(JournalLine::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Sum of credits posted to the given account by this entry.
     */
    public BigDecimal creditsTo(Long accountId) {
        return lines.stream()
            .filter(line -> line.getAccountId().equals(accountId))
            .map(JournalLine::getCredit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
