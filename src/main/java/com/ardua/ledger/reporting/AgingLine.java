package com.ardua.ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class AgingLine {
    Long invoiceId;
    String invoiceNumber;
    Long clientId;
    LocalDate dueDate;
    long daysPastDue;
    BigDecimal outstanding;
}
