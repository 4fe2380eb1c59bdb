package com.ardua.ledger.exception;

public class InvalidStateTransitionException extends LedgerDomainException {

    public InvalidStateTransitionException(String message) {
        super(ErrorCode.INVALID_STATE_TRANSITION, message);
    }
}
