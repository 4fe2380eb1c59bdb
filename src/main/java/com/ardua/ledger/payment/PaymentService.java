package com.ardua.ledger.payment;

import com.ardua.ledger.billing.ClientRepository;
import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoiceService;
import com.ardua.ledger.exception.AmountMismatchException;
import com.ardua.ledger.exception.InvalidStateTransitionException;
import com.ardua.ledger.exception.ResourceNotFoundException;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.ledger.JournalEntryRequest;
import com.ardua.ledger.ledger.LedgerService;
import com.ardua.ledger.ledger.SourceReference;
import com.ardua.ledger.ledger.SourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Client payments: recording, allocation to invoices and posting.
 *
 * Allocation keeps {@code sum(applications) + unapplied == amount} and never
 * applies more than an invoice's outstanding balance. Posting happens once per
 * payment: a second call returns the entry that already exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PaymentApplicationRepository applicationRepository;
    private final ClientRepository clientRepository;
    private final InvoiceService invoiceService;
    private final LedgerService ledgerService;
    private final ChartOfAccountsService chartOfAccounts;

    /**
     * Creates the payment, applies it to the given invoices and posts it.
     * Whatever is not allocated stays unapplied.
     */
    @Transactional
    public Payment recordPayment(Long clientId, LocalDate date, BigDecimal amount, PaymentMethod method,
                                 String memo, List<PaymentAllocation> allocations, String user) {
        Payment payment = createPayment(clientId, date, amount, method, memo);

        BigDecimal requested = allocations.stream()
            .map(PaymentAllocation::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (requested.compareTo(amount) > 0) {
            throw new AmountMismatchException(String.format(
                "Allocations total %s exceeds payment amount %s", requested, amount));
        }

        for (PaymentAllocation allocation : allocations) {
            allocate(payment, allocation.getInvoiceId(), allocation.getAmount());
        }

        postToAccounting(payment.getId(), user);
        return payment;
    }

    /**
     * Creates an unposted payment with everything unapplied.
     */
    @Transactional
    public Payment createPayment(Long clientId, LocalDate date, BigDecimal amount,
                                 PaymentMethod method, String memo) {
        if (!clientRepository.existsById(clientId)) {
            throw new ResourceNotFoundException("Client", clientId);
        }
        Payment payment = paymentRepository.save(Payment.receive(clientId, date, amount, method, memo));
        log.info("Recorded payment {} of {} from client {}", payment.getId(), amount, clientId);
        return payment;
    }

    /**
     * Applies part of an unposted payment to an invoice.
     *
     * @throws InvalidStateTransitionException if the payment is already posted
     */
    @Transactional
    public PaymentApplication applyToInvoice(Long paymentId, Long invoiceId, BigDecimal amount) {
        Payment payment = getPayment(paymentId);
        if (isPosted(paymentId)) {
            throw new InvalidStateTransitionException(
                "Payment " + paymentId + " is already posted; its applications can no longer change");
        }
        return allocate(payment, invoiceId, amount);
    }

    /**
     * Dr Cash for the payment amount, Cr Accounts Receivable for the applied
     * part, Cr Unapplied Payments for the rest. Zero lines are left out, so
     * the entry has two or three lines.
     */
    @Transactional
    public JournalEntry postToAccounting(Long paymentId, String user) {
        Payment payment = getPayment(paymentId);
        SourceReference source = SourceReference.of(SourceType.PAYMENT, paymentId);

        List<JournalEntry> existing = ledgerService.findEntriesForSource(source);
        if (!existing.isEmpty()) {
            log.debug("Payment {} already posted as entry {}", paymentId, existing.get(0).getId());
            return existing.get(0);
        }

        BigDecimal applied = applicationRepository.sumForPayment(paymentId);
        BigDecimal unapplied = payment.getAmount().subtract(applied);
        if (unapplied.signum() < 0) {
            throw new AmountMismatchException(String.format(
                "Payment %s has %s applied but is only %s", paymentId, applied, payment.getAmount()));
        }

        List<JournalEntryRequest.DebitCredit> credits = new ArrayList<>();
        if (applied.signum() > 0) {
            credits.add(JournalEntryRequest.DebitCredit.of(chartOfAccounts.accountsReceivable().getId(), applied));
        }
        if (unapplied.signum() > 0) {
            credits.add(JournalEntryRequest.DebitCredit.of(chartOfAccounts.unappliedPayments().getId(), unapplied));
        }

        JournalEntry entry = ledgerService.postEntry(new JournalEntryRequest(
            "Payment " + paymentId + " received (" + payment.getMethod() + ")",
            user,
            source,
            List.of(JournalEntryRequest.DebitCredit.of(chartOfAccounts.cashAccount().getId(), payment.getAmount())),
            credits).postedOn(payment.getPaymentDate()));

        log.info("Posted payment {}: applied={}, unapplied={}", paymentId, applied, unapplied);
        return entry;
    }

    @Transactional(readOnly = true)
    public boolean isPosted(Long paymentId) {
        return ledgerService.countEntriesForSource(SourceReference.of(SourceType.PAYMENT, paymentId)) > 0;
    }

    @Transactional(readOnly = true)
    public Payment getPayment(Long paymentId) {
        return paymentRepository.findById(paymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public List<Payment> listPaymentsForClient(Long clientId) {
        if (!clientRepository.existsById(clientId)) {
            throw new ResourceNotFoundException("Client", clientId);
        }
        return paymentRepository.findByClientIdOrderByPaymentDateAsc(clientId);
    }

    @Transactional(readOnly = true)
    public List<PaymentApplication> getApplications(Long paymentId) {
        return applicationRepository.findByPaymentIdOrderByIdAsc(paymentId);
    }

    private PaymentApplication allocate(Payment payment, Long invoiceId, BigDecimal amount) {
        Invoice invoice = invoiceService.getInvoice(invoiceId);
        if (!invoice.getClientId().equals(payment.getClientId())) {
            throw new IllegalArgumentException(
                "Invoice " + invoice.getInvoiceNumber() + " does not belong to the payment's client");
        }
        if (!invoice.isOpen()) {
            throw new InvalidStateTransitionException(
                "Invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus() + " and cannot take payments");
        }
        BigDecimal outstanding = invoiceService.outstandingBalance(invoiceId);
        if (amount.compareTo(outstanding) > 0) {
            throw new AmountMismatchException(String.format(
                "Cannot apply %s to invoice %s: outstanding balance is %s",
                amount, invoice.getInvoiceNumber(), outstanding));
        }

        payment.allocate(amount);
        paymentRepository.save(payment);
        PaymentApplication application = applicationRepository.save(
            PaymentApplication.of(payment.getId(), invoiceId, amount));
        invoiceService.refreshPaidStatus(invoiceId);
        return application;
    }
}
