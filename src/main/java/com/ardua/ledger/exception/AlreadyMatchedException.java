package com.ardua.ledger.exception;

/**
 * The bank transaction is already linked to a payment, an expense or a transfer counterpart.
 */
public class AlreadyMatchedException extends LedgerDomainException {

    public AlreadyMatchedException(Long bankTransactionId) {
        super(ErrorCode.ALREADY_MATCHED,
                "Bank transaction " + bankTransactionId + " is already matched");
    }

    public AlreadyMatchedException(String message) {
        super(ErrorCode.ALREADY_MATCHED, message);
    }
}
