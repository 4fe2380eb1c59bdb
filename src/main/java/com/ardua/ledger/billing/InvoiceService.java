package com.ardua.ledger.billing;

import com.ardua.ledger.exception.InvalidStateTransitionException;
import com.ardua.ledger.exception.ResourceNotFoundException;
import com.ardua.ledger.payment.PaymentApplicationRepository;
import com.ardua.ledger.posting.InvoicePostingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Invoice lifecycle. Issuing posts revenue; returning to draft and voiding an
 * issued invoice reverse it. Lines can only change while the invoice is a draft,
 * and a client has at most one draft at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final InvoiceLineRepository lineRepository;
    private final ClientRepository clientRepository;
    private final ExpenseRepository expenseRepository;
    private final PaymentApplicationRepository applicationRepository;
    private final InvoicePostingService postingService;

    /**
     * @param invoiceNumber null to take the next five-digit sequence number
     */
    @Transactional
    public Invoice createDraft(Long clientId, LocalDate issueDate, String invoiceNumber) {
        Client client = clientRepository.findById(clientId)
            .orElseThrow(() -> new ResourceNotFoundException("Client", clientId));

        if (invoiceRepository.existsByClientIdAndStatus(clientId, InvoiceStatus.DRAFT)) {
            throw new InvalidStateTransitionException(
                "Client " + client.getName() + " already has a draft invoice");
        }

        String number = invoiceNumber != null && !invoiceNumber.isBlank() ? invoiceNumber : nextInvoiceNumber();
        Invoice invoice = invoiceRepository.save(Invoice.draft(
            clientId, number, issueDate, issueDate.plusDays(client.getPaymentTermsDays())));

        log.info("Created draft invoice {} for client {}", number, clientId);
        return invoice;
    }

    @Transactional
    public InvoiceLine addLine(Long invoiceId, InvoiceLineType type, String description,
                               BigDecimal quantity, BigDecimal unitPrice) {
        Invoice invoice = getInvoice(invoiceId);
        InvoiceLine line = lineRepository.save(InvoiceLine.of(invoiceId, type, description, quantity, unitPrice));
        recalculateTotals(invoice);
        return line;
    }

    /**
     * Adds a billable expense of the invoice's client as an EXPENSE line.
     */
    @Transactional
    public InvoiceLine billExpense(Long invoiceId, Long expenseId) {
        Invoice invoice = getInvoice(invoiceId);
        Expense expense = expenseRepository.findById(expenseId)
            .orElseThrow(() -> new ResourceNotFoundException("Expense", expenseId));

        if (!expense.isBillable() || !invoice.getClientId().equals(expense.getClientId())) {
            throw new IllegalArgumentException(
                "Expense " + expenseId + " is not billable to the invoice's client");
        }
        if (expense.isBilled()) {
            throw new InvalidStateTransitionException("Expense " + expenseId + " is already on an invoice");
        }

        InvoiceLine line = lineRepository.save(InvoiceLine.of(
            invoiceId, InvoiceLineType.EXPENSE, expense.getDescription(), BigDecimal.ONE, expense.getAmount()));
        expense.billOn(line.getId());
        expenseRepository.save(expense);
        recalculateTotals(invoice);
        return line;
    }

    @Transactional
    public Invoice issue(Long invoiceId, String user) {
        Invoice invoice = getInvoice(invoiceId);
        invoice.issue();
        invoiceRepository.save(invoice);
        postingService.postInvoice(invoiceId, user);
        log.info("Issued invoice {} for {}", invoice.getInvoiceNumber(), invoice.getTotal());
        return invoice;
    }

    @Transactional
    public Invoice returnToDraft(Long invoiceId, String user) {
        Invoice invoice = getInvoice(invoiceId);
        if (invoiceRepository.existsByClientIdAndStatusAndIdNot(invoice.getClientId(), InvoiceStatus.DRAFT, invoiceId)) {
            throw new InvalidStateTransitionException(
                "Client already has another draft invoice; issue or void it first");
        }
        requireNoPayments(invoice, "return to draft");
        invoice.returnToDraft();
        invoiceRepository.save(invoice);
        postingService.reverseInvoice(invoiceId, user);
        log.info("Returned invoice {} to draft", invoice.getInvoiceNumber());
        return invoice;
    }

    @Transactional
    public Invoice voidInvoice(Long invoiceId, String user) {
        Invoice invoice = getInvoice(invoiceId);
        requireNoPayments(invoice, "void");
        invoice.markVoid();
        invoiceRepository.save(invoice);
        postingService.reverseInvoice(invoiceId, user);
        log.info("Voided invoice {}", invoice.getInvoiceNumber());
        return invoice;
    }

    /**
     * Manual PAID transition for invoices settled outside the system. Leaves the ledger untouched.
     */
    @Transactional
    public Invoice markPaid(Long invoiceId) {
        Invoice invoice = getInvoice(invoiceId);
        invoice.markPaid();
        log.info("Marked invoice {} as paid", invoice.getInvoiceNumber());
        return invoiceRepository.save(invoice);
    }

    /**
     * Moves an issued invoice to PAID once its applications cover the total.
     */
    @Transactional
    public Invoice refreshPaidStatus(Long invoiceId) {
        Invoice invoice = getInvoice(invoiceId);
        if (invoice.isOpen() && outstandingBalance(invoice).signum() <= 0) {
            invoice.markPaid();
            invoiceRepository.save(invoice);
            log.info("Invoice {} is fully paid", invoice.getInvoiceNumber());
        }
        return invoice;
    }

    @Transactional(readOnly = true)
    public BigDecimal outstandingBalance(Long invoiceId) {
        return outstandingBalance(getInvoice(invoiceId));
    }

    BigDecimal outstandingBalance(Invoice invoice) {
        return invoice.getTotal().subtract(applicationRepository.sumForInvoice(invoice.getId()));
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(Long invoiceId) {
        return invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    @Transactional(readOnly = true)
    public List<InvoiceLine> getLines(Long invoiceId) {
        return lineRepository.findByInvoiceIdOrderByIdAsc(invoiceId);
    }

    private void recalculateTotals(Invoice invoice) {
        invoice.updateTotals(lineRepository.sumLineTotals(invoice.getId()));
        invoiceRepository.save(invoice);
    }

    private void requireNoPayments(Invoice invoice, String action) {
        if (applicationRepository.sumForInvoice(invoice.getId()).signum() > 0) {
            throw new InvalidStateTransitionException(
                "Cannot " + action + " invoice " + invoice.getInvoiceNumber() + " with payments applied");
        }
    }

    private String nextInvoiceNumber() {
        long sequence = invoiceRepository.count() + 1;
        String candidate = String.format("%05d", sequence);
        while (invoiceRepository.existsByInvoiceNumber(candidate)) {
            sequence++;
            candidate = String.format("%05d", sequence);
        }
        return candidate;
    }
}
