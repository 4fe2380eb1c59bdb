package com.ardua.ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Portion of a payment allocated to one invoice.
 */
@Entity
@Table(name = "payment_applications")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentApplication {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private Long paymentId;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private Long invoiceId;

    @Column(nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal amount;

    static PaymentApplication of(Long paymentId, Long invoiceId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Applied amount must be positive");
        }
        PaymentApplication application = new PaymentApplication();
        application.paymentId = paymentId;
        application.invoiceId = invoiceId;
        application.amount = amount;
        return application;
    }
}
