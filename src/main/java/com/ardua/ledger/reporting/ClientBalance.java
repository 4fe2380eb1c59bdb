package com.ardua.ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ClientBalance {
    Long clientId;
    String clientName;
    BigDecimal invoiced;
    BigDecimal applied;
    BigDecimal unapplied;
    BigDecimal outstanding;

    /**
     * What the client still owes after unapplied credit.
     */
    public BigDecimal getNetReceivable() {
        return outstanding.subtract(unapplied);
    }
}
