package com.ardua.ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class TrialBalance {
    LocalDate from;
    LocalDate to;
    List<TrialBalanceRow> rows;
    BigDecimal totalDebits;
    BigDecimal totalCredits;

    public boolean isBalanced() {
        return totalDebits.compareTo(totalCredits) == 0;
    }
}
