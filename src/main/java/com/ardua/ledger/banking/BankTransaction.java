package com.ardua.ledger.banking;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One line of a bank statement. Positive amounts are money in, negative money out.
 *
 * At most one of payment, expense or transfer counterpart is linked; a
 * transaction with any of them is matched. {@code journalEntryId} points at
 * the entry currently recording it, which the matcher replaces on retag,
 * match and unmatch.
 */
@Entity
@Table(name = "bank_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BankTransaction {

    public static final int MAX_DESCRIPTION_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bank_account_id", nullable = false, updatable = false)
    private Long bankAccountId;

    @Column(name = "txn_date", nullable = false, updatable = false)
    private LocalDate date;

    @Column(nullable = false)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(name = "journal_entry_id")
    private Long journalEntryId;

    @Column(name = "offset_account_id")
    private Long offsetAccountId;

    @Column(name = "expense_id")
    private Long expenseId;

    @Column(name = "payment_id")
    private Long paymentId;

    @Column(name = "transfer_pair_id", unique = true)
    private Long transferPairId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BankTransaction record(Long bankAccountId, LocalDate date, String description,
                                  BigDecimal amount, Long offsetAccountId) {
        BankTransaction txn = new BankTransaction();
        txn.bankAccountId = bankAccountId;
        txn.date = date;
        txn.description = description;
        txn.amount = amount;
        txn.offsetAccountId = offsetAccountId;
        return txn;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public boolean isMatched() {
        return paymentId != null || expenseId != null || transferPairId != null;
    }

    public boolean isDeposit() {
        return amount.signum() > 0;
    }

    void attachEntry(Long journalEntryId) {
        this.journalEntryId = journalEntryId;
    }

    /**
     * Clears the entry reference before the entry is deleted.
     *
     * @return the id that was attached, or null
     */
    Long detachEntry() {
        Long previous = this.journalEntryId;
        this.journalEntryId = null;
        return previous;
    }

    void retag(Long offsetAccountId) {
        this.offsetAccountId = offsetAccountId;
    }

    void linkExpense(Long expenseId, Long expenseAccountId) {
        this.expenseId = expenseId;
        this.offsetAccountId = expenseAccountId;
    }

    void linkPayment(Long paymentId) {
        this.paymentId = paymentId;
    }

    void pairWith(Long counterpartId, Long counterpartGlAccountId) {
        this.transferPairId = counterpartId;
        this.offsetAccountId = counterpartGlAccountId;
    }

    void clearMatch() {
        this.paymentId = null;
        this.expenseId = null;
        this.transferPairId = null;
    }
}
