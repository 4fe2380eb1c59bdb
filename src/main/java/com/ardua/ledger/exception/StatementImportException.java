package com.ardua.ledger.exception;

import lombok.Getter;

/**
 * A statement row could not be parsed. The whole import is rolled back;
 * {@link #getRowNumber()} is 1-based and counts every physical CSV record.
 */
@Getter
public class StatementImportException extends LedgerDomainException {

    private final long rowNumber;

    public StatementImportException(long rowNumber, String message, Throwable cause) {
        super(ErrorCode.STATEMENT_IMPORT_FAILED, "Row " + rowNumber + ": " + message, cause);
        this.rowNumber = rowNumber;
    }
}
