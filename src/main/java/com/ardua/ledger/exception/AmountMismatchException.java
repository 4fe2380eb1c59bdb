package com.ardua.ledger.exception;

import java.math.BigDecimal;

public class AmountMismatchException extends LedgerDomainException {

    public AmountMismatchException(String message) {
        super(ErrorCode.AMOUNT_MISMATCH, message);
    }

    public AmountMismatchException(String what, BigDecimal expected, BigDecimal actual) {
        super(ErrorCode.AMOUNT_MISMATCH,
                String.format("%s: expected %s but was %s", what, expected, actual));
    }
}
