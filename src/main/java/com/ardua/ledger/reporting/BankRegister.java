package com.ardua.ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Register view of one bank account over an optional date range. With no
 * {@code from} date the balance forward is the opening balance.
 */
@Value
public class BankRegister {
    Long bankAccountId;
    LocalDate from;
    LocalDate to;
    BigDecimal balanceForward;
    List<RegisterRow> rows;
    BigDecimal endingBalance;
}
