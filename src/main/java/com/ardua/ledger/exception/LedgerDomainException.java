package com.ardua.ledger.exception;

import lombok.Getter;

/**
 * Base type for business-rule violations raised by the posting engine and the
 * bank transaction matcher. These describe invalid business state, so callers
 * render them to the user and never retry them.
 */
@Getter
public abstract class LedgerDomainException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerDomainException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerDomainException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
