package com.ardua.ledger.ledger;

/**
 * Chart-of-accounts classification. Assets and expenses carry debit-normal
 * balances; liabilities, equity and income carry credit-normal balances.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    INCOME,
    EXPENSE;

    public boolean isDebitNormal() {
        return this == ASSET || this == EXPENSE;
    }
}
