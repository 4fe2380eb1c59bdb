package com.ardua.ledger.reporting;

import com.ardua.ledger.ledger.AccountType;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class TrialBalanceRow {
    Long accountId;
    String code;
    String name;
    AccountType type;
    BigDecimal debits;
    BigDecimal credits;

    /**
     * Debits minus credits, whatever the account's normal side.
     */
    public BigDecimal getBalance() {
        return debits.subtract(credits);
    }
}
