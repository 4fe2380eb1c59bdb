package com.ardua.ledger.posting;

import com.ardua.ledger.billing.Client;
import com.ardua.ledger.billing.ClientService;
import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoiceLineType;
import com.ardua.ledger.billing.InvoicePostingState;
import com.ardua.ledger.billing.InvoiceService;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.ledger.LedgerService;
import com.ardua.ledger.ledger.SourceReference;
import com.ardua.ledger.ledger.SourceType;
import com.ardua.ledger.support.DatabaseCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Invoice revenue must be booked exactly once per issue, and every reversal
 * must be a new entry.
 */
@SpringBootTest
@ActiveProfiles("test")
class InvoicePostingServiceTest {

    @Autowired
    private InvoicePostingService postingService;

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private ClientService clientService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Client client;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbcTemplate);
        client = clientService.createClient("Globex", 30);
    }

    @Test
    @DisplayName("Issuing posts Dr AR / Cr Revenue for the total")
    void issuePostsRevenue() {
        // Given
        Invoice invoice = draftWithTotal("1200.00");

        // When
        invoiceService.issue(invoice.getId(), "alice");

        // Then
        List<JournalEntry> entries = ledgerService.findEntriesForSource(
            SourceReference.of(SourceType.INVOICE, invoice.getId()));
        assertEquals(1, entries.size());
        JournalEntry entry = entries.get(0);
        assertEquals(0, entry.debitsTo(chartOfAccounts.accountsReceivable().getId())
            .compareTo(new BigDecimal("1200.00")));
        assertEquals(0, entry.creditsTo(chartOfAccounts.revenue().getId())
            .compareTo(new BigDecimal("1200.00")));
        assertEquals("alice", entry.getPostedBy());
        assertEquals(InvoicePostingState.POSTED, invoiceService.getInvoice(invoice.getId()).getPostingState());
    }

    @Test
    @DisplayName("Posting an already posted invoice does nothing")
    void postIsIdempotent() {
        Invoice invoice = draftWithTotal("400.00");
        invoiceService.issue(invoice.getId(), null);

        Optional<JournalEntry> second = postingService.postInvoice(invoice.getId(), null);

        assertTrue(second.isEmpty());
        assertEquals(1, ledgerService.countEntriesForSource(SourceReference.of(SourceType.INVOICE, invoice.getId())));
    }

    @Test
    @DisplayName("Reversing an unposted invoice does nothing")
    void reverseUnpostedIsNoop() {
        Invoice invoice = draftWithTotal("400.00");

        assertTrue(postingService.reverseInvoice(invoice.getId(), null).isEmpty());
        assertEquals(0, ledgerService.countEntriesForSource(SourceReference.of(SourceType.INVOICE, invoice.getId())));
    }

    @Test
    @DisplayName("Issue, return to draft, reissue leaves three entries and one net posting")
    void reissueAppendsEntries() {
        // Given
        Invoice invoice = draftWithTotal("750.00");
        Long arId = chartOfAccounts.accountsReceivable().getId();

        // When
        invoiceService.issue(invoice.getId(), null);
        invoiceService.returnToDraft(invoice.getId(), null);
        assertEquals(0, ledgerService.getAccountBalance(arId).signum(), "Reversal cancels receivable");
        invoiceService.issue(invoice.getId(), null);

        // Then
        assertEquals(3, ledgerService.countEntriesForSource(SourceReference.of(SourceType.INVOICE, invoice.getId())));
        assertEquals(0, ledgerService.getAccountBalance(arId).compareTo(new BigDecimal("750.00")));
        assertEquals(0, ledgerService.getAccountBalance(chartOfAccounts.revenue().getId())
            .compareTo(new BigDecimal("750.00")));
    }

    @Test
    @DisplayName("Zero-total invoice is marked posted without a journal entry")
    void zeroTotalInvoice() {
        Invoice invoice = invoiceService.createDraft(client.getId(), LocalDate.of(2024, 5, 1), null);

        invoiceService.issue(invoice.getId(), null);

        assertEquals(InvoicePostingState.POSTED, invoiceService.getInvoice(invoice.getId()).getPostingState());
        assertEquals(0, ledgerService.countEntriesForSource(SourceReference.of(SourceType.INVOICE, invoice.getId())));
    }

    private Invoice draftWithTotal(String amount) {
        Invoice invoice = invoiceService.createDraft(client.getId(), LocalDate.of(2024, 5, 1), null);
        invoiceService.addLine(invoice.getId(), InvoiceLineType.TIME, "Consulting",
            BigDecimal.ONE, new BigDecimal(amount));
        return invoice;
    }
}
