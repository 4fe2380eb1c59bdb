package com.ardua.ledger.billing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    boolean existsByClientIdAndStatus(Long clientId, InvoiceStatus status);

    boolean existsByClientIdAndStatusAndIdNot(Long clientId, InvoiceStatus status, Long id);

    boolean existsByInvoiceNumber(String invoiceNumber);

    List<Invoice> findByStatusInOrderByDueDateAscIdAsc(Collection<InvoiceStatus> statuses);

    List<Invoice> findByClientIdOrderByIssueDateAscIdAsc(Long clientId);
}
