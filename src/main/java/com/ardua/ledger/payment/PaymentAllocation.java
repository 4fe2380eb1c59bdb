package com.ardua.ledger.payment;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Requested application of part of a payment to one invoice.
 */
@Value
public class PaymentAllocation {
    Long invoiceId;
    BigDecimal amount;
}
