package com.ardua.ledger.banking;

import com.ardua.ledger.billing.Client;
import com.ardua.ledger.billing.ClientService;
import com.ardua.ledger.billing.Expense;
import com.ardua.ledger.billing.ExpenseCategory;
import com.ardua.ledger.billing.ExpenseService;
import com.ardua.ledger.ledger.AccountType;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.payment.Payment;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ReconciliationServiceTest {

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private BankTransactionService transactionService;

    @Autowired
    private BankAccountService bankAccountService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private ExpenseService expenseService;

    @Autowired
    private ClientService clientService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private BankAccount checking;
    private Long miscId;
    private Client client;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbcTemplate);
        checking = bankAccountService.createBankAccount(
            BankAccountType.CHECKING, "First Bank", "****1234", BigDecimal.ZERO);
        miscId = chartOfAccounts.createAccount("6900", "Miscellaneous", AccountType.EXPENSE).getId();
        client = clientService.createClient("Acme", 30);
    }

    @Test
    @DisplayName("Unmatched lists split deposits from withdrawals")
    void listsUnmatched() {
        BankTransaction deposit = post("Deposit", "120.00");
        BankTransaction withdrawal = post("Fee", "-5.00");

        assertEquals(List.of(deposit.getId()), ids(reconciliationService.unmatchedDeposits(checking.getId())));
        assertEquals(List.of(withdrawal.getId()), ids(reconciliationService.unmatchedWithdrawals(checking.getId())));
    }

    @Test
    @DisplayName("Payment candidates have the exact amount and no link yet")
    void paymentCandidates() {
        Payment match = paymentService.createPayment(client.getId(), LocalDate.of(2024, 6, 1),
            new BigDecimal("120.00"), PaymentMethod.CHECK, "");
        paymentService.createPayment(client.getId(), LocalDate.of(2024, 6, 1),
            new BigDecimal("119.00"), PaymentMethod.CHECK, "");
        BankTransaction deposit = post("Deposit", "120.00");
        BankTransaction withdrawal = post("Fee", "-120.00");

        List<Payment> candidates = reconciliationService.paymentCandidates(deposit.getId());

        assertEquals(1, candidates.size());
        assertEquals(match.getId(), candidates.get(0).getId());
        assertTrue(reconciliationService.paymentCandidates(withdrawal.getId()).isEmpty());
    }

    @Test
    @DisplayName("Expense and transfer candidates match on amount")
    void expenseAndTransferCandidates() {
        ExpenseCategory category = expenseService.createCategory("Misc", miscId, false);
        Expense expense = expenseService.createExpense(null, category.getId(),
            LocalDate.of(2024, 6, 1), new BigDecimal("60.00"), "Tools", false);
        BankAccount savings = bankAccountService.createBankAccount(
            BankAccountType.SAVINGS, "First Bank", "****5678", BigDecimal.ZERO);
        BankTransaction withdrawal = post("Hardware store", "-60.00");
        BankTransaction counterpart = transactionService.postTransaction(savings.getId(),
            LocalDate.of(2024, 6, 2), "In", new BigDecimal("60.00"), miscId);

        List<Expense> expenses = reconciliationService.expenseCandidates(withdrawal.getId());
        List<BankTransaction> transfers = reconciliationService.transferCandidates(withdrawal.getId());

        assertEquals(1, expenses.size());
        assertEquals(expense.getId(), expenses.get(0).getId());
        assertEquals(List.of(counterpart.getId()), ids(transfers));
    }

    @Test
    @DisplayName("Batch link commits good rows, skips matched ones and reports failures")
    void batchLinksPayments() {
        // Given
        Payment first = paymentService.createPayment(client.getId(), LocalDate.of(2024, 6, 1),
            new BigDecimal("100.00"), PaymentMethod.CHECK, "");
        Payment wrongAmount = paymentService.createPayment(client.getId(), LocalDate.of(2024, 6, 1),
            new BigDecimal("99.00"), PaymentMethod.CHECK, "");
        Payment third = paymentService.createPayment(client.getId(), LocalDate.of(2024, 6, 1),
            new BigDecimal("300.00"), PaymentMethod.CHECK, "");
        BankTransaction a = post("Deposit A", "100.00");
        BankTransaction b = post("Deposit B", "200.00");
        BankTransaction c = post("Deposit C", "300.00");
        transactionService.linkExistingPayment(c.getId(), third.getId());

        Map<Long, Long> links = new LinkedHashMap<>();
        links.put(a.getId(), first.getId());
        links.put(b.getId(), wrongAmount.getId());
        links.put(c.getId(), third.getId());

        // When
        BatchMatchResult result = reconciliationService.linkPayments(links);

        // Then
        assertEquals(List.of(a.getId()), result.getLinked());
        assertEquals(List.of(c.getId()), result.getSkipped());
        assertTrue(result.hasErrors());
        assertEquals(b.getId(), result.getErrors().get(0).getBankTransactionId());
        assertEquals(first.getId(), transactionService.getTransaction(a.getId()).getPaymentId());
        assertFalse(transactionService.getTransaction(b.getId()).isMatched());
    }

    @Test
    @DisplayName("Batch expense link reports a missing GL account per row")
    void batchLinksExpenses() {
        ExpenseCategory mapped = expenseService.createCategory("Misc", miscId, false);
        ExpenseCategory unmapped = expenseService.createCategory("Unmapped", null, false);
        Expense good = expenseService.createExpense(null, mapped.getId(),
            LocalDate.of(2024, 6, 1), new BigDecimal("10.00"), "Good", false);
        Expense bad = expenseService.createExpense(null, unmapped.getId(),
            LocalDate.of(2024, 6, 1), new BigDecimal("20.00"), "Bad", false);
        BankTransaction first = post("One", "-10.00");
        BankTransaction second = post("Two", "-20.00");

        Map<Long, Long> links = new LinkedHashMap<>();
        links.put(first.getId(), good.getId());
        links.put(second.getId(), bad.getId());

        BatchMatchResult result = reconciliationService.linkExpenses(links);

        assertEquals(1, result.getLinkedCount());
        assertEquals(1, result.getErrors().size());
        assertEquals(second.getId(), result.getErrors().get(0).getBankTransactionId());
    }

    private BankTransaction post(String description, String amount) {
        return transactionService.postTransaction(checking.getId(),
            LocalDate.of(2024, 6, 2), description, new BigDecimal(amount), miscId);
    }

    private static List<Long> ids(List<BankTransaction> transactions) {
        return transactions.stream().map(BankTransaction::getId).toList();
    }
}
