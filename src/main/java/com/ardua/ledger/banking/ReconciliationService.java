package com.ardua.ledger.banking;

import com.ardua.ledger.billing.Expense;
import com.ardua.ledger.billing.ExpenseRepository;
import com.ardua.ledger.exception.LedgerDomainException;
import com.ardua.ledger.payment.Payment;
import com.ardua.ledger.payment.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Match suggestions for unmatched bank transactions and batch linking.
 *
 * Batch runs commit row by row: a failed row is reported and rolled back on
 * its own, rows before and after it stay linked.
 */
@Service
@Slf4j
public class ReconciliationService {

    private final BankTransactionRepository transactionRepository;
    private final PaymentRepository paymentRepository;
    private final ExpenseRepository expenseRepository;
    private final BankTransactionService bankTransactionService;
    private final TransactionTemplate rowTransaction;

    public ReconciliationService(BankTransactionRepository transactionRepository,
                                 PaymentRepository paymentRepository,
                                 ExpenseRepository expenseRepository,
                                 BankTransactionService bankTransactionService,
                                 PlatformTransactionManager transactionManager) {
        this.transactionRepository = transactionRepository;
        this.paymentRepository = paymentRepository;
        this.expenseRepository = expenseRepository;
        this.bankTransactionService = bankTransactionService;
        this.rowTransaction = new TransactionTemplate(transactionManager);
        this.rowTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Transactional(readOnly = true)
    public List<BankTransaction> unmatchedDeposits(Long bankAccountId) {
        return transactionRepository.findUnmatchedDeposits(bankAccountId);
    }

    @Transactional(readOnly = true)
    public List<BankTransaction> unmatchedWithdrawals(Long bankAccountId) {
        return transactionRepository.findUnmatchedWithdrawals(bankAccountId);
    }

    /**
     * Payments of exactly the deposit amount that no transaction links yet.
     * Withdrawals have none.
     */
    @Transactional(readOnly = true)
    public List<Payment> paymentCandidates(Long txnId) {
        BankTransaction txn = bankTransactionService.getTransaction(txnId);
        if (!txn.isDeposit()) {
            return List.of();
        }
        return paymentRepository.findUnlinkedByAmount(txn.getAmount());
    }

    /**
     * Unsettled expenses for the transaction's absolute amount.
     */
    @Transactional(readOnly = true)
    public List<Expense> expenseCandidates(Long txnId) {
        BankTransaction txn = bankTransactionService.getTransaction(txnId);
        return expenseRepository.findByPaymentAccountIdIsNullAndAmountOrderByExpenseDateAsc(txn.getAmount().abs());
    }

    /**
     * Unmatched transactions on other accounts with the opposite amount.
     */
    @Transactional(readOnly = true)
    public List<BankTransaction> transferCandidates(Long txnId) {
        BankTransaction txn = bankTransactionService.getTransaction(txnId);
        return transactionRepository.findTransferCandidates(txn.getBankAccountId(), txn.getAmount().negate());
    }

    /**
     * @param links bank transaction id to expense id, processed in iteration order
     */
    public BatchMatchResult linkExpenses(Map<Long, Long> links) {
        return runBatch("expenses", links, bankTransactionService::linkExpense);
    }

    /**
     * @param links bank transaction id to payment id, processed in iteration order
     */
    public BatchMatchResult linkPayments(Map<Long, Long> links) {
        return runBatch("payments", links, bankTransactionService::linkExistingPayment);
    }

    private BatchMatchResult runBatch(String what, Map<Long, Long> links, BiConsumer<Long, Long> linker) {
        List<Long> linked = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        List<BatchMatchResult.RowError> errors = new ArrayList<>();

        links.forEach((txnId, targetId) -> {
            try {
                boolean done = Boolean.TRUE.equals(rowTransaction.execute(status -> {
                    if (bankTransactionService.getTransaction(txnId).isMatched()) {
                        return false;
                    }
                    linker.accept(txnId, targetId);
                    return true;
                }));
                (done ? linked : skipped).add(txnId);
            } catch (LedgerDomainException | IllegalArgumentException e) {
                log.warn("Batch link of {}: transaction {} -> {} failed: {}", what, txnId, targetId, e.getMessage());
                errors.add(new BatchMatchResult.RowError(txnId, e.getMessage()));
            }
        });

        log.info("Batch link of {}: linked={}, skipped={}, failed={}",
            what, linked.size(), skipped.size(), errors.size());
        return new BatchMatchResult(linked, skipped, errors);
    }
}
