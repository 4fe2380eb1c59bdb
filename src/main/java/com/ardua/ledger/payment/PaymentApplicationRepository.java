package com.ardua.ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface PaymentApplicationRepository extends JpaRepository<PaymentApplication, Long> {

    List<PaymentApplication> findByPaymentIdOrderByIdAsc(Long paymentId);

    @Query("SELECT COALESCE(SUM(a.amount), 0) FROM PaymentApplication a WHERE a.paymentId = :paymentId")
    BigDecimal sumForPayment(@Param("paymentId") Long paymentId);

    @Query("SELECT COALESCE(SUM(a.amount), 0) FROM PaymentApplication a WHERE a.invoiceId = :invoiceId")
    BigDecimal sumForInvoice(@Param("invoiceId") Long invoiceId);

    /**
     * Everything applied to any invoice of the client, whichever payment it came from.
     */
    @Query("""
        SELECT COALESCE(SUM(a.amount), 0) FROM PaymentApplication a, Invoice i
        WHERE a.invoiceId = i.id AND i.clientId = :clientId
        """)
    BigDecimal sumForClientInvoices(@Param("clientId") Long clientId);
}
