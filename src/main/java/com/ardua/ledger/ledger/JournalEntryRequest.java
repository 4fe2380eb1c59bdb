package com.ardua.ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Lines to post as one journal entry. Sum of debits must equal sum of credits;
 * {@link LedgerService} refuses anything else. A null {@code postedAt} means
 * "now" on the ledger clock. Descriptions are composed from document text and
 * are cut to {@link JournalEntry#MAX_DESCRIPTION_LENGTH}.
 */
@Value
public class JournalEntryRequest {
    String description;
    String postedBy;
    SourceReference source;
    List<DebitCredit> debits;
    List<DebitCredit> credits;
    LocalDateTime postedAt;

    public JournalEntryRequest(String description, String postedBy, SourceReference source,
                               List<DebitCredit> debits, List<DebitCredit> credits) {
        this(description, postedBy, source, debits, credits, null);
    }

    public JournalEntryRequest(String description, String postedBy, SourceReference source,
                               List<DebitCredit> debits, List<DebitCredit> credits, LocalDateTime postedAt) {
        this.description = fit(description);
        this.postedBy = postedBy;
        this.source = source;
        this.debits = List.copyOf(debits);
        this.credits = List.copyOf(credits);
        this.postedAt = postedAt;
    }

    /**
     * Two-line entry moving {@code amount} from the credited account to the debited one.
     */
    public static JournalEntryRequest simple(String description, String postedBy, SourceReference source,
                                             Long debitAccountId, Long creditAccountId, BigDecimal amount) {
        return new JournalEntryRequest(
            description,
            postedBy,
            source,
            List.of(DebitCredit.of(debitAccountId, amount)),
            List.of(DebitCredit.of(creditAccountId, amount))
        );
    }

    /**
     * Same lines, dated at the start of the given business day.
     */
    public JournalEntryRequest postedOn(LocalDate date) {
        return new JournalEntryRequest(description, postedBy, source, debits, credits, date.atStartOfDay());
    }

    private static String fit(String description) {
        if (description == null || description.length() <= JournalEntry.MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, JournalEntry.MAX_DESCRIPTION_LENGTH);
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public BigDecimal getDebitTotal() {
        return debits.stream()
            .map(DebitCredit::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return credits.stream()
            .map(DebitCredit::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Value
    public static class DebitCredit {
        Long accountId;
        BigDecimal amount;

        private DebitCredit(Long accountId, BigDecimal amount) {
            this.accountId = Objects.requireNonNull(accountId, "accountId");
            this.amount = Objects.requireNonNull(amount, "amount");
            if (amount.signum() <= 0) {
                throw new IllegalArgumentException("Line amount must be positive: " + amount);
            }
        }

        public static DebitCredit of(Long accountId, BigDecimal amount) {
            return new DebitCredit(accountId, amount);
        }
    }
}
