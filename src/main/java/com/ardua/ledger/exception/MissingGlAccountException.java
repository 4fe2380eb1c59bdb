package com.ardua.ledger.exception;

public class MissingGlAccountException extends LedgerDomainException {

    public MissingGlAccountException(String categoryName) {
        super(ErrorCode.MISSING_GL_ACCOUNT,
                "Expense category '" + categoryName + "' has no GL account assigned");
    }
}
