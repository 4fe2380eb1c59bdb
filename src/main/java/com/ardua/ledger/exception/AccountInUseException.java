package com.ardua.ledger.exception;

public class AccountInUseException extends LedgerDomainException {

    public AccountInUseException(String code, Throwable cause) {
        super(ErrorCode.ACCOUNT_IN_USE,
                "Account " + code + " is referenced and cannot be deleted; deactivate it instead", cause);
    }
}
