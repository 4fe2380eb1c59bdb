package com.ardua.ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Money received from a client. The part not allocated to invoices is kept in
 * {@code unappliedAmount}; {@link PaymentService} keeps
 * {@code sum(applications) + unappliedAmount == amount}.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id", nullable = false, updatable = false)
    private Long clientId;

    @Column(name = "payment_date", nullable = false)
    private LocalDate paymentDate;

    @Column(nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod method;

    @Column(nullable = false)
    private String memo;

    @Column(name = "unapplied_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal unappliedAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static Payment receive(Long clientId, LocalDate paymentDate, BigDecimal amount,
                           PaymentMethod method, String memo) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        Payment payment = new Payment();
        payment.clientId = clientId;
        payment.paymentDate = paymentDate;
        payment.amount = amount;
        payment.method = method;
        payment.memo = memo != null ? memo : "";
        payment.unappliedAmount = amount;
        return payment;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    /**
     * Moves {@code applied} from the unapplied balance onto an invoice.
     */
    void allocate(BigDecimal applied) {
        if (applied.compareTo(unappliedAmount) > 0) {
            throw new IllegalArgumentException(String.format(
                "Cannot apply %s from payment %s: only %s unapplied", applied, id, unappliedAmount));
        }
        this.unappliedAmount = unappliedAmount.subtract(applied);
    }

    /**
     * The bank statement date wins over the date the user typed in.
     */
    public void alignDateWith(LocalDate statementDate) {
        this.paymentDate = statementDate;
    }
}
