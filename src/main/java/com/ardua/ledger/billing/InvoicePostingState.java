package com.ardua.ledger.billing;

/**
 * Whether the invoice's revenue currently sits in the ledger.
 * UNPOSTED before the first issue, then POSTED and REVERSED alternate.
 */
public enum InvoicePostingState {
    UNPOSTED,
    POSTED,
    REVERSED;

    public boolean isPosted() {
        return this == POSTED;
    }
}
