package com.ardua.ledger.billing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Expense grouping. {@code accountId} is the GL expense account charged when
 * an expense in this category is settled from a bank account; it may be unset.
 */
@Entity
@Table(name = "expense_categories")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExpenseCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "account_id")
    private Long accountId;

    @Column(name = "billable_by_default", nullable = false)
    private boolean billableByDefault;

    public static ExpenseCategory create(String name, Long accountId, boolean billableByDefault) {
        ExpenseCategory category = new ExpenseCategory();
        category.name = name;
        category.accountId = accountId;
        category.billableByDefault = billableByDefault;
        return category;
    }

    public void assignAccount(Long accountId) {
        this.accountId = accountId;
    }

    public boolean hasAccount() {
        return accountId != null;
    }
}
