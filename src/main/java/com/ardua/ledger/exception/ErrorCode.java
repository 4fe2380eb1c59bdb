package com.ardua.ledger.exception;

/**
 * Stable codes returned to API callers alongside domain errors.
 */
public enum ErrorCode {
    ALREADY_MATCHED,
    AMOUNT_MISMATCH,
    MISSING_GL_ACCOUNT,
    SAME_ACCOUNT_TRANSFER,
    INVALID_CONFIGURATION,
    ACCOUNT_IN_USE,
    INVALID_STATE_TRANSITION,
    STATEMENT_IMPORT_FAILED
}
