package com.ardua.ledger.ledger;

/**
 * Kind of business document a journal entry was posted for.
 */
public enum SourceType {
    INVOICE,
    PAYMENT,
    BANK_TRANSACTION,
    BANK_ACCOUNT,
    EXPENSE
}
