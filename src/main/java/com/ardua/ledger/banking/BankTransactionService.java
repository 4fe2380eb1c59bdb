package com.ardua.ledger.banking;

import com.ardua.ledger.billing.Expense;
import com.ardua.ledger.billing.ExpenseCategory;
import com.ardua.ledger.billing.ExpenseRepository;
import com.ardua.ledger.billing.ExpenseService;
import com.ardua.ledger.event.BankTransactionMatchedEvent;
import com.ardua.ledger.event.BankTransactionMatchedEvent.MatchKind;
import com.ardua.ledger.exception.AlreadyMatchedException;
import com.ardua.ledger.exception.AmountMismatchException;
import com.ardua.ledger.exception.InvalidStateTransitionException;
import com.ardua.ledger.exception.MissingGlAccountException;
import com.ardua.ledger.exception.ResourceNotFoundException;
import com.ardua.ledger.exception.SameAccountTransferException;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.ledger.JournalEntryRequest;
import com.ardua.ledger.ledger.LedgerService;
import com.ardua.ledger.ledger.SourceReference;
import com.ardua.ledger.ledger.SourceType;
import com.ardua.ledger.observability.CorrelationContext;
import com.ardua.ledger.observability.LedgerMetrics;
import com.ardua.ledger.outbox.OutboxService;
import com.ardua.ledger.payment.Payment;
import com.ardua.ledger.payment.PaymentAllocation;
import com.ardua.ledger.payment.PaymentMethod;
import com.ardua.ledger.payment.PaymentRepository;
import com.ardua.ledger.payment.PaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Posts bank transactions and links them to payments, expenses and transfer
 * counterparts.
 *
 * An unmatched transaction owns one two-line entry: a deposit debits the bank's
 * GL account and credits the offset account, a withdrawal does the opposite for
 * the absolute amount. Retagging rewrites that entry's lines in place; matching
 * deletes it and posts the entry of whatever the transaction was matched to.
 * Each public method is one database transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankTransactionService {

    private final BankTransactionRepository transactionRepository;
    private final BankAccountService bankAccountService;
    private final LedgerService ledgerService;
    private final ChartOfAccountsService chartOfAccounts;
    private final ExpenseService expenseService;
    private final ExpenseRepository expenseRepository;
    private final PaymentService paymentService;
    private final PaymentRepository paymentRepository;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Records a statement line and posts it against {@code offsetAccountId}.
     *
     * @throws IllegalArgumentException for a zero amount, a description over
     *         {@link BankTransaction#MAX_DESCRIPTION_LENGTH} characters, or an offset
     *         equal to the bank's own GL account
     */
    @Transactional
    public BankTransaction postTransaction(Long bankAccountId, LocalDate date, String description,
                                          BigDecimal amount, Long offsetAccountId) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(offsetAccountId, "offsetAccountId");
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Bank transaction amount must be non-zero");
        }
        if (description != null && description.length() > BankTransaction.MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                "Bank transaction description exceeds " + BankTransaction.MAX_DESCRIPTION_LENGTH + " characters");
        }
        BankAccount bankAccount = bankAccountService.getBankAccount(bankAccountId);
        requireDistinctOffset(bankAccount, offsetAccountId);
        chartOfAccounts.getAccount(offsetAccountId);

        BankTransaction txn = transactionRepository.save(BankTransaction.record(
            bankAccountId, date, description != null ? description : "", amount, offsetAccountId));

        JournalEntry entry = ledgerService.postEntry(ownEntryRequest(txn, bankAccount, offsetAccountId));
        txn.attachEntry(entry.getId());
        transactionRepository.save(txn);

        log.debug("Posted bank transaction {} on account {}: {} {}",
            txn.getId(), bankAccountId, date, amount);
        return txn;
    }

    /**
     * Points an unmatched transaction at a different offset account. The
     * entry keeps its id; only its lines are rebuilt.
     *
     * @throws AlreadyMatchedException if the transaction is matched
     */
    @Transactional
    public BankTransaction retagTransaction(Long txnId, Long newOffsetAccountId) {
        BankTransaction txn = getTransaction(txnId);
        if (txn.isMatched() || txn.getJournalEntryId() == null) {
            throw new AlreadyMatchedException(txnId);
        }
        BankAccount bankAccount = bankAccountService.getBankAccount(txn.getBankAccountId());
        requireDistinctOffset(bankAccount, newOffsetAccountId);

        Long previous = txn.getOffsetAccountId();
        ledgerService.replaceLines(txn.getJournalEntryId(), ownEntryRequest(txn, bankAccount, newOffsetAccountId));
        txn.retag(newOffsetAccountId);
        transactionRepository.save(txn);

        withTransactionContext(txnId, () ->
            log.info("Retagged bank transaction {}: offset {} -> {}", txnId, previous, newOffsetAccountId));
        return txn;
    }

    /**
     * Owner contributions and draws: retag against Owner Equity.
     */
    @Transactional
    public BankTransaction markAsOwnerEquity(Long txnId) {
        return retagTransaction(txnId, chartOfAccounts.ownerEquity().getId());
    }

    /**
     * Replaces the transaction's entry with Dr expense category account /
     * Cr bank for the absolute amount and marks the expense as paid from
     * this bank account.
     *
     * @throws AlreadyMatchedException if either side is already linked
     * @throws MissingGlAccountException if the expense's category has no GL account
     */
    @Transactional
    public Expense linkExpense(Long txnId, Long expenseId) {
        BankTransaction txn = getTransaction(txnId);
        if (txn.isMatched()) {
            throw new AlreadyMatchedException(txnId);
        }
        Expense expense = expenseService.getExpense(expenseId);
        if (expense.isSettled() || transactionRepository.existsByExpenseId(expenseId)) {
            throw new AlreadyMatchedException("Expense " + expenseId + " is already linked to a bank transaction");
        }
        ExpenseCategory category = expenseService.getCategory(expense.getCategoryId());
        if (!category.hasAccount()) {
            throw new MissingGlAccountException(category.getName());
        }
        BankAccount bankAccount = bankAccountService.getBankAccount(txn.getBankAccountId());

        dropEntry(txn);

        JournalEntry entry = ledgerService.postEntry(JournalEntryRequest.simple(
            "Expense: " + describe(expense.getDescription(), txn),
            null,
            SourceReference.of(SourceType.EXPENSE, expenseId),
            category.getAccountId(),
            bankAccount.getAccountId(),
            txn.getAmount().abs()).postedOn(txn.getDate()));

        expense.settleFrom(bankAccount.getId());
        expenseRepository.save(expense);
        txn.linkExpense(expenseId, category.getAccountId());
        txn.attachEntry(entry.getId());
        transactionRepository.save(txn);

        recordMatch(txn, MatchKind.EXPENSE, expenseId, entry.getId());
        withTransactionContext(txnId, () ->
            log.info("Linked bank transaction {} to expense {} ({})", txnId, expenseId, category.getName()));
        return expense;
    }

    /**
     * Creates an overhead expense from a withdrawal and links it: no client,
     * not billable, dated and described like the transaction.
     */
    @Transactional
    public Expense createAndLinkExpense(Long txnId, Long categoryId) {
        BankTransaction txn = getTransaction(txnId);
        if (txn.isMatched()) {
            throw new AlreadyMatchedException(txnId);
        }
        Expense expense = expenseService.createExpense(
            null, categoryId, txn.getDate(), txn.getAmount().abs(), txn.getDescription(), false);
        return linkExpense(txnId, expense.getId());
    }

    /**
     * Matches two legs of a transfer between the business's own accounts.
     * Both legs' entries are replaced by one shared entry: Dr destination
     * GL / Cr source GL. The leg with the negative amount is the source;
     * when neither is negative the first argument is.
     *
     * @throws AlreadyMatchedException if either leg is matched
     * @throws SameAccountTransferException if both legs are on the same bank account
     * @throws AmountMismatchException if the absolute amounts differ
     */
    @Transactional
    public JournalEntry matchTransfer(Long firstTxnId, Long secondTxnId) {
        BankTransaction first = getTransaction(firstTxnId);
        BankTransaction second = getTransaction(secondTxnId);
        if (first.isMatched()) {
            throw new AlreadyMatchedException(firstTxnId);
        }
        if (second.isMatched()) {
            throw new AlreadyMatchedException(secondTxnId);
        }
        if (first.getBankAccountId().equals(second.getBankAccountId())) {
            throw new SameAccountTransferException(first.getBankAccountId());
        }
        if (first.getAmount().abs().compareTo(second.getAmount().abs()) != 0) {
            throw new AmountMismatchException("Transfer amounts",
                first.getAmount().abs(), second.getAmount().abs());
        }

        boolean firstIsSource = first.getAmount().signum() < 0 || second.getAmount().signum() >= 0;
        BankTransaction source = firstIsSource ? first : second;
        BankTransaction destination = firstIsSource ? second : first;
        BankAccount sourceAccount = bankAccountService.getBankAccount(source.getBankAccountId());
        BankAccount destinationAccount = bankAccountService.getBankAccount(destination.getBankAccountId());

        dropEntry(source);
        dropEntry(destination);

        JournalEntry entry = ledgerService.postEntry(JournalEntryRequest.simple(
            "Transfer " + sourceAccount.displayName() + " -> " + destinationAccount.displayName(),
            null,
            SourceReference.of(SourceType.BANK_TRANSACTION, source.getId()),
            destinationAccount.getAccountId(),
            sourceAccount.getAccountId(),
            source.getAmount().abs()).postedOn(source.getDate()));

        source.pairWith(destination.getId(), destinationAccount.getAccountId());
        source.attachEntry(entry.getId());
        destination.pairWith(source.getId(), sourceAccount.getAccountId());
        destination.attachEntry(entry.getId());
        transactionRepository.saveAll(List.of(source, destination));

        recordMatch(source, MatchKind.TRANSFER, destination.getId(), entry.getId());
        recordMatch(destination, MatchKind.TRANSFER, source.getId(), entry.getId());
        log.info("Matched transfer {} -> {} for {}", source.getId(), destination.getId(), source.getAmount().abs());
        return entry;
    }

    /**
     * Links a deposit to a payment recorded earlier. The statement date
     * overrides the payment date, the deposit's own entry is removed and the
     * payment's entry (posted now if needed) becomes the transaction's entry.
     *
     * @throws AlreadyMatchedException if the transaction is matched or the payment is linked elsewhere
     * @throws AmountMismatchException unless the amounts are exactly equal
     */
    @Transactional
    public Payment linkExistingPayment(Long txnId, Long paymentId) {
        BankTransaction txn = getTransaction(txnId);
        if (txn.isMatched()) {
            throw new AlreadyMatchedException(txnId);
        }
        Payment payment = paymentService.getPayment(paymentId);
        transactionRepository.findByPaymentId(paymentId).ifPresent(other -> {
            throw new AlreadyMatchedException(
                "Payment " + paymentId + " is already linked to bank transaction " + other.getId());
        });
        if (payment.getAmount().compareTo(txn.getAmount()) != 0) {
            throw new AmountMismatchException("Payment amount", txn.getAmount(), payment.getAmount());
        }
        return attachPayment(txn, payment);
    }

    /**
     * Records a new payment for the deposit amount, applies it to the given
     * invoices and links it to the transaction.
     */
    @Transactional
    public Payment createPaymentFromTransaction(Long txnId, Long clientId, PaymentMethod method,
                                                String memo, List<PaymentAllocation> allocations) {
        BankTransaction txn = getTransaction(txnId);
        if (txn.isMatched()) {
            throw new AlreadyMatchedException(txnId);
        }
        if (!txn.isDeposit()) {
            throw new IllegalArgumentException("Bank transaction " + txnId + " is not a deposit");
        }
        BigDecimal requested = allocations.stream()
            .map(PaymentAllocation::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (requested.compareTo(txn.getAmount()) > 0) {
            throw new AmountMismatchException("Allocations for deposit " + txnId, txn.getAmount(), requested);
        }

        Payment payment = paymentService.createPayment(
            clientId, txn.getDate(), txn.getAmount(), method, memo != null ? memo : txn.getDescription());
        for (PaymentAllocation allocation : allocations) {
            paymentService.applyToInvoice(payment.getId(), allocation.getInvoiceId(), allocation.getAmount());
        }
        return attachPayment(txn, payment);
    }

    /**
     * Undoes a payment, expense or transfer link and gives the transaction
     * (both legs for a transfer) a fresh entry against {@code offsetAccountId}.
     * A linked payment keeps its own entry; an expense or transfer entry is deleted.
     *
     * @throws InvalidStateTransitionException if the transaction is not matched
     */
    @Transactional
    public BankTransaction unmatchTransaction(Long txnId, Long offsetAccountId) {
        BankTransaction txn = getTransaction(txnId);
        if (!txn.isMatched()) {
            throw new InvalidStateTransitionException("Bank transaction " + txnId + " is not matched");
        }
        chartOfAccounts.getAccount(offsetAccountId);

        if (txn.getPaymentId() != null) {
            txn.detachEntry();
            txn.clearMatch();
            repost(txn, offsetAccountId);
        } else if (txn.getExpenseId() != null) {
            Expense expense = expenseService.getExpense(txn.getExpenseId());
            expense.clearPaymentAccount();
            expenseRepository.save(expense);
            txn.clearMatch();
            dropEntry(txn);
            repost(txn, offsetAccountId);
        } else {
            BankTransaction counterpart = getTransaction(txn.getTransferPairId());
            txn.clearMatch();
            counterpart.clearMatch();
            counterpart.detachEntry();
            transactionRepository.saveAndFlush(counterpart);
            dropEntry(txn);
            repost(txn, offsetAccountId);
            repost(counterpart, offsetAccountId);
        }

        withTransactionContext(txnId, () ->
            log.info("Unmatched bank transaction {}, reposted against account {}", txnId, offsetAccountId));
        return txn;
    }

    @Transactional(readOnly = true)
    public BankTransaction getTransaction(Long txnId) {
        return transactionRepository.findById(txnId)
            .orElseThrow(() -> new ResourceNotFoundException("Bank transaction", txnId));
    }

    @Transactional(readOnly = true)
    public List<BankTransaction> listTransactions(Long bankAccountId) {
        bankAccountService.getBankAccount(bankAccountId);
        return transactionRepository.findByBankAccountIdOrderByDateAscIdAsc(bankAccountId);
    }

    private Payment attachPayment(BankTransaction txn, Payment payment) {
        if (!payment.getPaymentDate().equals(txn.getDate())) {
            log.debug("Payment {} date {} replaced by statement date {}",
                payment.getId(), payment.getPaymentDate(), txn.getDate());
            payment.alignDateWith(txn.getDate());
            paymentRepository.save(payment);
        }

        dropEntry(txn);
        JournalEntry entry = paymentService.postToAccounting(payment.getId(), null);

        txn.linkPayment(payment.getId());
        txn.attachEntry(entry.getId());
        transactionRepository.save(txn);

        recordMatch(txn, MatchKind.PAYMENT, payment.getId(), entry.getId());
        withTransactionContext(txn.getId(), () ->
            log.info("Linked bank transaction {} to payment {} ({})", txn.getId(), payment.getId(), payment.getAmount()));
        return payment;
    }

    private void repost(BankTransaction txn, Long offsetAccountId) {
        BankAccount bankAccount = bankAccountService.getBankAccount(txn.getBankAccountId());
        requireDistinctOffset(bankAccount, offsetAccountId);
        JournalEntry entry = ledgerService.postEntry(ownEntryRequest(txn, bankAccount, offsetAccountId));
        txn.retag(offsetAccountId);
        txn.attachEntry(entry.getId());
        transactionRepository.save(txn);
        recordMatch(txn, MatchKind.UNMATCHED, null, entry.getId());
    }

    /**
     * Deletes the transaction's current entry. The reference is cleared and
     * flushed first so the row never points at a deleted entry.
     */
    private void dropEntry(BankTransaction txn) {
        Long entryId = txn.detachEntry();
        transactionRepository.saveAndFlush(txn);
        if (entryId != null) {
            ledgerService.deleteEntry(entryId);
        }
    }

    private JournalEntryRequest ownEntryRequest(BankTransaction txn, BankAccount bankAccount, Long offsetAccountId) {
        boolean deposit = txn.isDeposit();
        return JournalEntryRequest.simple(
            txn.getDescription(),
            null,
            SourceReference.of(SourceType.BANK_TRANSACTION, txn.getId()),
            deposit ? bankAccount.getAccountId() : offsetAccountId,
            deposit ? offsetAccountId : bankAccount.getAccountId(),
            txn.getAmount().abs()).postedOn(txn.getDate());
    }

    private void requireDistinctOffset(BankAccount bankAccount, Long offsetAccountId) {
        if (bankAccount.getAccountId().equals(offsetAccountId)) {
            throw new IllegalArgumentException(
                "Offset account cannot be the bank account's own GL account " + offsetAccountId);
        }
    }

    private void recordMatch(BankTransaction txn, MatchKind kind, Long counterpartId, Long entryId) {
        outboxService.saveEvent(BankTransactionMatchedEvent.of(
            txn.getId(), kind, counterpartId, entryId, clock.instant()));
        ledgerMetrics.recordMatch(kind.name().toLowerCase());
    }

    private static String describe(String expenseDescription, BankTransaction txn) {
        return expenseDescription != null && !expenseDescription.isBlank() ? expenseDescription : txn.getDescription();
    }

    private static void withTransactionContext(Long txnId, Runnable logStatement) {
        MDC.put(CorrelationContext.BANK_TRANSACTION_ID_MDC_KEY, String.valueOf(txnId));
        try {
            logStatement.run();
        } finally {
            MDC.remove(CorrelationContext.BANK_TRANSACTION_ID_MDC_KEY);
        }
    }
}
