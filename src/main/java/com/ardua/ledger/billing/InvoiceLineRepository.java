package com.ardua.ledger.billing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface InvoiceLineRepository extends JpaRepository<InvoiceLine, Long> {

    List<InvoiceLine> findByInvoiceIdOrderByIdAsc(Long invoiceId);

    @Query("SELECT COALESCE(SUM(l.lineTotal), 0) FROM InvoiceLine l WHERE l.invoiceId = :invoiceId")
    BigDecimal sumLineTotals(@Param("invoiceId") Long invoiceId);
}
