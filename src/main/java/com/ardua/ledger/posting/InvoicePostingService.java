package com.ardua.ledger.posting;

import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoiceRepository;
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

import java.util.Optional;

/**
 * Records invoice revenue in the ledger.
 *
 * The journal is append-only for invoices: a reversal is a second entry with
 * the lines swapped, never a deletion. Whether revenue is currently booked is
 * tracked on {@link Invoice#getPostingState()}, so posting twice or reversing
 * an unposted invoice does nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoicePostingService {

    private final InvoiceRepository invoiceRepository;
    private final LedgerService ledgerService;
    private final ChartOfAccountsService chartOfAccounts;

    /**
     * Dr Accounts Receivable / Cr Revenue for the invoice total.
     *
     * @return the new entry, or empty when the invoice is already posted or
     *         its total is zero
     */
    @Transactional
    public Optional<JournalEntry> postInvoice(Long invoiceId, String user) {
        Invoice invoice = load(invoiceId);
        if (invoice.getPostingState().isPosted()) {
            log.debug("Invoice {} already posted, skipping", invoice.getInvoiceNumber());
            return Optional.empty();
        }

        Optional<JournalEntry> entry = Optional.empty();
        if (invoice.getTotal().signum() > 0) {
            entry = Optional.of(ledgerService.postEntry(JournalEntryRequest.simple(
                "Invoice " + invoice.getInvoiceNumber() + " issued",
                user,
                SourceReference.of(SourceType.INVOICE, invoice.getId()),
                chartOfAccounts.accountsReceivable().getId(),
                chartOfAccounts.revenue().getId(),
                invoice.getTotal())));
        } else {
            log.info("Invoice {} has a zero total, nothing to post", invoice.getInvoiceNumber());
        }

        invoice.markPosted();
        invoiceRepository.save(invoice);
        return entry;
    }

    /**
     * Dr Revenue / Cr Accounts Receivable for the invoice total, appended as a new entry.
     *
     * @return the reversing entry, or empty when the invoice is not currently posted
     */
    @Transactional
    public Optional<JournalEntry> reverseInvoice(Long invoiceId, String user) {
        Invoice invoice = load(invoiceId);
        if (!invoice.getPostingState().isPosted()) {
            log.debug("Invoice {} is not posted, nothing to reverse", invoice.getInvoiceNumber());
            return Optional.empty();
        }

        Optional<JournalEntry> entry = Optional.empty();
        if (invoice.getTotal().signum() > 0) {
            entry = Optional.of(ledgerService.postEntry(JournalEntryRequest.simple(
                "Invoice " + invoice.getInvoiceNumber() + " reversed",
                user,
                SourceReference.of(SourceType.INVOICE, invoice.getId()),
                chartOfAccounts.revenue().getId(),
                chartOfAccounts.accountsReceivable().getId(),
                invoice.getTotal())));
        }

        invoice.markReversed();
        invoiceRepository.save(invoice);
        return entry;
    }

    private Invoice load(Long invoiceId) {
        return invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }
}
