package com.ardua.ledger.billing;

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
 * A cost incurred, optionally on behalf of a client. {@code paymentAccountId}
 * is the bank account that paid it, set when a bank transaction is linked.
 */
@Entity
@Table(name = "expenses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Expense {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id")
    private Long clientId;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(nullable = false)
    private boolean billable;

    @Column(name = "payment_account_id")
    private Long paymentAccountId;

    @Column(name = "invoice_line_id", unique = true)
    private Long invoiceLineId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static Expense create(Long clientId, Long categoryId, LocalDate expenseDate,
                                 BigDecimal amount, String description, boolean billable) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Expense amount must be positive");
        }
        Expense expense = new Expense();
        expense.clientId = clientId;
        expense.categoryId = categoryId;
        expense.expenseDate = expenseDate;
        expense.amount = amount;
        expense.description = description != null ? description : "";
        expense.billable = billable;
        return expense;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public void settleFrom(Long bankAccountId) {
        this.paymentAccountId = bankAccountId;
    }

    public void clearPaymentAccount() {
        this.paymentAccountId = null;
    }

    public boolean isSettled() {
        return paymentAccountId != null;
    }

    void billOn(Long invoiceLineId) {
        this.invoiceLineId = invoiceLineId;
    }

    public boolean isBilled() {
        return invoiceLineId != null;
    }
}
