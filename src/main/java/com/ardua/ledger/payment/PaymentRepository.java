package com.ardua.ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    /**
     * Payments of the given amount that no bank transaction points at yet.
     */
    @Query("""
        SELECT p FROM Payment p
        WHERE p.amount = :amount
          AND NOT EXISTS (SELECT t.id FROM BankTransaction t WHERE t.paymentId = p.id)
        ORDER BY p.paymentDate ASC, p.id ASC
        """)
    List<Payment> findUnlinkedByAmount(@Param("amount") BigDecimal amount);

    @Query("SELECT COALESCE(SUM(p.unappliedAmount), 0) FROM Payment p WHERE p.clientId = :clientId")
    BigDecimal sumUnappliedForClient(@Param("clientId") Long clientId);

    List<Payment> findByClientIdOrderByPaymentDateAsc(Long clientId);
}
