package com.ardua.ledger.billing;

public enum InvoiceLineType {
    TIME,
    EXPENSE,
    ADJUSTMENT,
    GENERAL
}
