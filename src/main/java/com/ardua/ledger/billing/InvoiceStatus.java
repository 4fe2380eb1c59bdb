package com.ardua.ledger.billing;

/**
 * DRAFT -> ISSUED -> PAID, DRAFT/ISSUED -> VOID, ISSUED -> DRAFT.
 */
public enum InvoiceStatus {
    DRAFT,
    ISSUED,
    PAID,
    VOID
}
