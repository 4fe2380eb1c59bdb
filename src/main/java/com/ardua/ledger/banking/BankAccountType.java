package com.ardua.ledger.banking;

import com.ardua.ledger.ledger.AccountType;

public enum BankAccountType {
    CHECKING,
    SAVINGS,
    CREDIT_CARD,
    CASH;

    /**
     * Credit cards are money owed, so their GL account is a liability.
     */
    public AccountType glAccountType() {
        return this == CREDIT_CARD ? AccountType.LIABILITY : AccountType.ASSET;
    }
}
