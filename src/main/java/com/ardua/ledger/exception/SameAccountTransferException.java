package com.ardua.ledger.exception;

public class SameAccountTransferException extends LedgerDomainException {

    public SameAccountTransferException(Long bankAccountId) {
        super(ErrorCode.SAME_ACCOUNT_TRANSFER,
                "Both sides of a transfer belong to bank account " + bankAccountId);
    }
}
