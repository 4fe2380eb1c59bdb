package com.ardua.ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Income and expense accounts over a period. Revenue is reported on its
 * credit side and expenses on their debit side, so both totals are normally
 * positive.
 */
@Value
public class IncomeStatement {
    LocalDate from;
    LocalDate to;
    List<TrialBalanceRow> incomeAccounts;
    List<TrialBalanceRow> expenseAccounts;
    BigDecimal revenueTotal;
    BigDecimal expenseTotal;

    public BigDecimal getNetIncome() {
        return revenueTotal.subtract(expenseTotal);
    }
}
