package com.ardua.ledger.reporting;

import com.ardua.ledger.banking.BankAccount;
import com.ardua.ledger.banking.BankAccountService;
import com.ardua.ledger.banking.BankAccountType;
import com.ardua.ledger.banking.BankTransactionService;
import com.ardua.ledger.ledger.AccountType;
import com.ardua.ledger.ledger.ChartOfAccountsService;
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

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class BalanceServiceTest {

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private BankAccountService bankAccountService;

    @Autowired
    private BankTransactionService transactionService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private BankAccount checking;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbcTemplate);
        checking = bankAccountService.createBankAccount(
            BankAccountType.CHECKING, "First Bank", "****1234", new BigDecimal("1000.00"));
        Long miscId = chartOfAccounts.createAccount("6900", "Miscellaneous", AccountType.EXPENSE).getId();

        // Posted out of date order on purpose
        transactionService.postTransaction(checking.getId(), LocalDate.of(2024, 2, 10), "Rent",
            new BigDecimal("-400.00"), miscId);
        transactionService.postTransaction(checking.getId(), LocalDate.of(2024, 1, 15), "Deposit",
            new BigDecimal("250.00"), miscId);
        transactionService.postTransaction(checking.getId(), LocalDate.of(2024, 3, 5), "Fee",
            new BigDecimal("-10.00"), miscId);
    }

    @Test
    @DisplayName("Balance is the opening balance plus every transaction")
    void balanceIncludesOpening() {
        assertEquals(0, balanceService.bankAccountBalance(checking.getId()).compareTo(new BigDecimal("840.00")));
    }

    @Test
    @DisplayName("Full register runs in date order from the opening balance")
    void fullRegister() {
        BankRegister register = balanceService.runningBalanceForRange(checking.getId(), null, null);

        assertEquals(0, register.getBalanceForward().compareTo(new BigDecimal("1000.00")));
        assertEquals(3, register.getRows().size());
        assertEquals("Deposit", register.getRows().get(0).getDescription());
        assertEquals(0, register.getRows().get(0).getRunningBalance().compareTo(new BigDecimal("1250.00")));
        assertEquals(0, register.getRows().get(1).getRunningBalance().compareTo(new BigDecimal("850.00")));
        assertEquals(0, register.getEndingBalance().compareTo(new BigDecimal("840.00")));
    }

    @Test
    @DisplayName("Ranged register carries earlier activity forward")
    void rangedRegister() {
        BankRegister register = balanceService.runningBalanceForRange(
            checking.getId(), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));

        assertEquals(0, register.getBalanceForward().compareTo(new BigDecimal("1250.00")));
        assertEquals(1, register.getRows().size());
        assertEquals(0, register.getEndingBalance().compareTo(new BigDecimal("850.00")));
    }

    @Test
    @DisplayName("Open-ended ranges and inverted ranges")
    void openEndedRanges() {
        assertEquals(2, balanceService.runningBalanceForRange(
            checking.getId(), LocalDate.of(2024, 2, 10), null).getRows().size());
        assertEquals(1, balanceService.runningBalanceForRange(
            checking.getId(), null, LocalDate.of(2024, 1, 31)).getRows().size());
        assertThrows(IllegalArgumentException.class, () -> balanceService.runningBalanceForRange(
            checking.getId(), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 2, 1)));
    }
}
