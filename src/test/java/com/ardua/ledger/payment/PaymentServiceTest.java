package com.ardua.ledger.payment;

import com.ardua.ledger.billing.Client;
import com.ardua.ledger.billing.ClientService;
import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoiceLineType;
import com.ardua.ledger.billing.InvoiceService;
import com.ardua.ledger.exception.AmountMismatchException;
import com.ardua.ledger.exception.InvalidStateTransitionException;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.ledger.LedgerService;
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

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class PaymentServiceTest {

    @Autowired
    private PaymentService paymentService;

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
    private Invoice invoice;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbcTemplate);
        client = clientService.createClient("Initech", 30);
        invoice = invoiceService.createDraft(client.getId(), LocalDate.of(2024, 3, 1), null);
        invoiceService.addLine(invoice.getId(), InvoiceLineType.TIME, "Consulting",
            BigDecimal.ONE, new BigDecimal("200.00"));
        invoiceService.issue(invoice.getId(), null);
    }

    @Test
    @DisplayName("Fully applied payment posts two lines: Dr Cash / Cr AR")
    void fullyAppliedPaymentHasTwoLines() {
        // When
        Payment payment = paymentService.recordPayment(client.getId(), LocalDate.of(2024, 3, 20),
            new BigDecimal("200.00"), PaymentMethod.CHECK, "Check 1001",
            List.of(new PaymentAllocation(invoice.getId(), new BigDecimal("200.00"))), "bob");

        // Then
        JournalEntry entry = paymentService.postToAccounting(payment.getId(), null);
        assertEquals(2, entry.getLines().size());
        assertEquals(0, entry.debitsTo(chartOfAccounts.cashAccount().getId()).compareTo(new BigDecimal("200.00")));
        assertEquals(0, entry.creditsTo(chartOfAccounts.accountsReceivable().getId()).compareTo(new BigDecimal("200.00")));
        assertEquals(LocalDate.of(2024, 3, 20).atStartOfDay(), entry.getPostedAt());
        assertEquals(0, paymentService.getPayment(payment.getId()).getUnappliedAmount().signum());
    }

    @Test
    @DisplayName("Overpayment leaves the rest in Unapplied Payments as a third line")
    void overpaymentHasThreeLines() {
        Payment payment = paymentService.recordPayment(client.getId(), LocalDate.of(2024, 3, 20),
            new BigDecimal("300.00"), PaymentMethod.ACH, null,
            List.of(new PaymentAllocation(invoice.getId(), new BigDecimal("200.00"))), null);

        JournalEntry entry = paymentService.postToAccounting(payment.getId(), null);

        assertEquals(3, entry.getLines().size());
        assertEquals(0, entry.creditsTo(chartOfAccounts.unappliedPayments().getId()).compareTo(new BigDecimal("100.00")));
        assertEquals(0, paymentService.getPayment(payment.getId()).getUnappliedAmount().compareTo(new BigDecimal("100.00")));
        assertTrue(entry.isBalanced());
    }

    @Test
    @DisplayName("Posting twice returns the existing entry")
    void postIsIdempotent() {
        Payment payment = paymentService.recordPayment(client.getId(), LocalDate.of(2024, 3, 20),
            new BigDecimal("50.00"), PaymentMethod.CASH, "", List.of(), null);

        JournalEntry first = paymentService.postToAccounting(payment.getId(), null);
        JournalEntry second = paymentService.postToAccounting(payment.getId(), null);

        assertEquals(first.getId(), second.getId());
        assertTrue(paymentService.isPosted(payment.getId()));
    }

    @Test
    @DisplayName("Cannot apply more than the invoice's outstanding balance")
    void rejectsOverApplication() {
        assertThrows(AmountMismatchException.class, () -> paymentService.recordPayment(client.getId(),
            LocalDate.of(2024, 3, 20), new BigDecimal("500.00"), PaymentMethod.CHECK, "",
            List.of(new PaymentAllocation(invoice.getId(), new BigDecimal("250.00"))), null));
        assertEquals(0, invoiceService.outstandingBalance(invoice.getId()).compareTo(new BigDecimal("200.00")));
    }

    @Test
    @DisplayName("Allocations larger than the payment are rejected")
    void rejectsAllocationsAbovePayment() {
        assertThrows(AmountMismatchException.class, () -> paymentService.recordPayment(client.getId(),
            LocalDate.of(2024, 3, 20), new BigDecimal("100.00"), PaymentMethod.CHECK, "",
            List.of(new PaymentAllocation(invoice.getId(), new BigDecimal("150.00"))), null));
    }

    @Test
    @DisplayName("Posted payment's applications are frozen")
    void postedPaymentIsFrozen() {
        Payment payment = paymentService.recordPayment(client.getId(), LocalDate.of(2024, 3, 20),
            new BigDecimal("100.00"), PaymentMethod.CHECK, "", List.of(), null);

        assertThrows(InvalidStateTransitionException.class,
            () -> paymentService.applyToInvoice(payment.getId(), invoice.getId(), new BigDecimal("50.00")));
    }

    @Test
    @DisplayName("Unposted payment can be applied in steps before posting")
    void appliesBeforePosting() {
        Payment payment = paymentService.createPayment(client.getId(), LocalDate.of(2024, 3, 21),
            new BigDecimal("200.00"), PaymentMethod.CARD, "");

        paymentService.applyToInvoice(payment.getId(), invoice.getId(), new BigDecimal("120.00"));
        paymentService.applyToInvoice(payment.getId(), invoice.getId(), new BigDecimal("80.00"));

        assertEquals(2, paymentService.getApplications(payment.getId()).size());
        assertFalse(paymentService.isPosted(payment.getId()));
        assertEquals(0, ledgerService.getAccountBalance(chartOfAccounts.cashAccount().getId()).signum());
    }

    @Test
    @DisplayName("Client payments are listed oldest first")
    void listsPaymentsForClient() {
        Payment later = paymentService.recordPayment(client.getId(), LocalDate.of(2024, 4, 2),
            new BigDecimal("10.00"), PaymentMethod.CASH, "", List.of(), null);
        Payment earlier = paymentService.recordPayment(client.getId(), LocalDate.of(2024, 3, 25),
            new BigDecimal("20.00"), PaymentMethod.CASH, "", List.of(), null);

        List<Payment> payments = paymentService.listPaymentsForClient(client.getId());

        assertEquals(List.of(earlier.getId(), later.getId()),
            payments.stream().map(Payment::getId).toList());
    }
}
