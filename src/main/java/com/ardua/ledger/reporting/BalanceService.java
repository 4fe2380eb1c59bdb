package com.ardua.ledger.reporting;

import com.ardua.ledger.banking.BankAccount;
import com.ardua.ledger.banking.BankAccountService;
import com.ardua.ledger.banking.BankTransaction;
import com.ardua.ledger.banking.BankTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Bank balances, always derived from the transactions on every call.
 */
@Service
@RequiredArgsConstructor
public class BalanceService {

    private final BankAccountService bankAccountService;
    private final BankTransactionRepository transactionRepository;

    /**
     * Opening balance plus the sum of every transaction amount.
     */
    @Transactional(readOnly = true)
    public BigDecimal bankAccountBalance(Long bankAccountId) {
        BankAccount bankAccount = bankAccountService.getBankAccount(bankAccountId);
        return bankAccount.getOpeningBalance().add(transactionRepository.sumAmounts(bankAccountId));
    }

    /**
     * Register for {@code [from, to]}, both ends inclusive and both optional.
     * Rows are ordered by date, then by id.
     */
    @Transactional(readOnly = true)
    public BankRegister runningBalanceForRange(Long bankAccountId, LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after its end " + to);
        }
        BankAccount bankAccount = bankAccountService.getBankAccount(bankAccountId);

        BigDecimal balanceForward = bankAccount.getOpeningBalance();
        if (from != null) {
            balanceForward = balanceForward.add(transactionRepository.sumAmountsBefore(bankAccountId, from));
        }

        BigDecimal running = balanceForward;
        List<RegisterRow> rows = new ArrayList<>();
        for (BankTransaction txn : transactionsInRange(bankAccountId, from, to)) {
            running = running.add(txn.getAmount());
            rows.add(new RegisterRow(
                txn.getId(), txn.getDate(), txn.getDescription(), txn.getAmount(), running, txn.isMatched()));
        }

        return new BankRegister(bankAccountId, from, to, balanceForward, rows, running);
    }

    private List<BankTransaction> transactionsInRange(Long bankAccountId, LocalDate from, LocalDate to) {
        if (from != null && to != null) {
            return transactionRepository.findByBankAccountIdAndDateBetweenOrderByDateAscIdAsc(bankAccountId, from, to);
        }
        if (from != null) {
            return transactionRepository.findByBankAccountIdAndDateGreaterThanEqualOrderByDateAscIdAsc(bankAccountId, from);
        }
        if (to != null) {
            return transactionRepository.findByBankAccountIdAndDateLessThanEqualOrderByDateAscIdAsc(bankAccountId, to);
        }
        return transactionRepository.findByBankAccountIdOrderByDateAscIdAsc(bankAccountId);
    }
}
