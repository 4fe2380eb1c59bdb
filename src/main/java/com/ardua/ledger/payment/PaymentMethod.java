package com.ardua.ledger.payment;

public enum PaymentMethod {
    CHECK,
    ACH,
    CASH,
    CARD,
    OTHER
}
