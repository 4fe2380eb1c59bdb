package com.ardua.ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class RegisterRow {
    Long bankTransactionId;
    LocalDate date;
    String description;
    BigDecimal amount;
    BigDecimal runningBalance;
    boolean matched;
}
