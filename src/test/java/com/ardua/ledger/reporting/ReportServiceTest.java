package com.ardua.ledger.reporting;

import com.ardua.ledger.banking.BankAccount;
import com.ardua.ledger.banking.BankAccountService;
import com.ardua.ledger.banking.BankAccountType;
import com.ardua.ledger.banking.BankTransactionService;
import com.ardua.ledger.billing.Client;
import com.ardua.ledger.billing.ClientService;
import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoiceLineType;
import com.ardua.ledger.billing.InvoiceService;
import com.ardua.ledger.ledger.AccountType;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.payment.PaymentAllocation;
import com.ardua.ledger.payment.PaymentMethod;
import com.ardua.ledger.payment.PaymentService;
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
class ReportServiceTest {

    @Autowired
    private ReportService reportService;

    @Autowired
    private ClientService clientService;

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private BankAccountService bankAccountService;

    @Autowired
    private BankTransactionService transactionService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbcTemplate);
    }

    @Test
    @DisplayName("Trial balance totals agree and inactive accounts show zero")
    void trialBalanceBalances() {
        // Given
        Client client = clientService.createClient("Acme", 30);
        issueInvoice(client, LocalDate.of(2024, 1, 1), "900.00");
        bankAccountService.createBankAccount(BankAccountType.CHECKING, "First Bank", "****1", new BigDecimal("500.00"));

        // When
        TrialBalance trialBalance = reportService.trialBalance(null, null);

        // Then
        assertTrue(trialBalance.isBalanced());
        assertEquals(0, trialBalance.getTotalDebits().compareTo(new BigDecimal("1400.00")));
        TrialBalanceRow unapplied = trialBalance.getRows().stream()
            .filter(row -> row.getAccountId().equals(chartOfAccounts.unappliedPayments().getId()))
            .findFirst().orElseThrow();
        assertEquals(0, unapplied.getDebits().signum());
        assertEquals(0, unapplied.getCredits().signum());
    }

    @Test
    @DisplayName("Income statement reports revenue as positive and nets expenses against it")
    void incomeStatement() {
        // Given
        Long softwareId = chartOfAccounts.createAccount("6300", "Software", AccountType.EXPENSE).getId();
        BankAccount checking = bankAccountService.createBankAccount(
            BankAccountType.CHECKING, "First Bank", "****1", BigDecimal.ZERO);
        Long revenueId = chartOfAccounts.revenue().getId();
        transactionService.postTransaction(checking.getId(), LocalDate.of(2024, 5, 3), "Client deposit",
            new BigDecimal("1000.00"), revenueId);
        transactionService.postTransaction(checking.getId(), LocalDate.of(2024, 5, 10), "Subscription",
            new BigDecimal("-120.00"), softwareId);
        transactionService.postTransaction(checking.getId(), LocalDate.of(2024, 6, 2), "Next month",
            new BigDecimal("-80.00"), softwareId);

        // When
        IncomeStatement may = reportService.incomeStatement(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31));

        // Then
        assertEquals(0, may.getRevenueTotal().compareTo(new BigDecimal("1000.00")));
        assertEquals(0, may.getExpenseTotal().compareTo(new BigDecimal("120.00")));
        assertEquals(0, may.getNetIncome().compareTo(new BigDecimal("880.00")));
        assertTrue(may.getIncomeAccounts().stream().allMatch(row -> row.getType() == AccountType.INCOME));
        assertTrue(may.getExpenseAccounts().stream().anyMatch(row -> row.getAccountId().equals(softwareId)));
    }

    @Test
    @DisplayName("Client summary counts billed invoices, applied and unapplied payments")
    void clientBalanceSummary() {
        // Given
        Client acme = clientService.createClient("Acme", 30);
        Client zeta = clientService.createClient("Zeta", 30);
        Invoice billed = issueInvoice(acme, LocalDate.of(2024, 1, 1), "500.00");
        Invoice voided = issueInvoice(acme, LocalDate.of(2024, 1, 5), "70.00");
        invoiceService.voidInvoice(voided.getId(), null);
        paymentService.recordPayment(acme.getId(), LocalDate.of(2024, 1, 20), new BigDecimal("250.00"),
            PaymentMethod.CHECK, "", List.of(new PaymentAllocation(billed.getId(), new BigDecimal("200.00"))), null);

        // When
        List<ClientBalance> summary = reportService.clientBalanceSummary();

        // Then
        assertEquals(2, summary.size());
        ClientBalance first = summary.get(0);
        assertEquals("Acme", first.getClientName());
        assertEquals(0, first.getInvoiced().compareTo(new BigDecimal("500.00")));
        assertEquals(0, first.getApplied().compareTo(new BigDecimal("200.00")));
        assertEquals(0, first.getUnapplied().compareTo(new BigDecimal("50.00")));
        assertEquals(0, first.getOutstanding().compareTo(new BigDecimal("300.00")));
        assertEquals(0, first.getNetReceivable().compareTo(new BigDecimal("250.00")));
        assertEquals(zeta.getId(), summary.get(1).getClientId());
        assertEquals(0, summary.get(1).getInvoiced().signum());
    }

    @Test
    @DisplayName("Aging buckets follow days past due")
    void arAging() {
        // Given
        Client client = clientService.createClient("Acme", 30);
        Invoice notYetDue = issueInvoice(client, LocalDate.of(2024, 3, 1), "100.00");
        Invoice late = issueInvoice(client, LocalDate.of(2024, 1, 1), "200.00");
        Invoice veryLate = issueInvoice(client, LocalDate.of(2023, 10, 1), "300.00");
        Invoice paid = issueInvoice(client, LocalDate.of(2023, 9, 1), "400.00");
        paymentService.recordPayment(client.getId(), LocalDate.of(2023, 10, 15), new BigDecimal("400.00"),
            PaymentMethod.ACH, "", List.of(new PaymentAllocation(paid.getId(), new BigDecimal("400.00"))), null);

        // When
        AgingReport report = reportService.arAging(LocalDate.of(2024, 3, 15));

        // Then
        assertEquals(notYetDue.getId(), report.getBuckets().get(AgingBucket.CURRENT_TO_30).get(0).getInvoiceId());
        assertEquals(late.getId(), report.getBuckets().get(AgingBucket.DAYS_31_TO_60).get(0).getInvoiceId());
        assertEquals(44, report.getBuckets().get(AgingBucket.DAYS_31_TO_60).get(0).getDaysPastDue());
        assertTrue(report.getBuckets().get(AgingBucket.DAYS_61_TO_90).isEmpty());
        assertEquals(veryLate.getId(), report.getBuckets().get(AgingBucket.OVER_90).get(0).getInvoiceId());
        assertEquals(0, report.getTotalOutstanding().compareTo(new BigDecimal("600.00")));
        assertEquals(0, report.totalFor(AgingBucket.OVER_90).compareTo(new BigDecimal("300.00")));
    }

    private Invoice issueInvoice(Client client, LocalDate issueDate, String amount) {
        Invoice invoice = invoiceService.createDraft(client.getId(), issueDate, null);
        invoiceService.addLine(invoice.getId(), InvoiceLineType.GENERAL, "Services",
            BigDecimal.ONE, new BigDecimal(amount));
        return invoiceService.issue(invoice.getId(), null);
    }
}
