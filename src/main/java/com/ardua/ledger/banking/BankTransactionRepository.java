package com.ardua.ledger.banking;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface BankTransactionRepository extends JpaRepository<BankTransaction, Long> {

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM BankTransaction t WHERE t.bankAccountId = :bankAccountId")
    BigDecimal sumAmounts(@Param("bankAccountId") Long bankAccountId);

    @Query("""
        SELECT COALESCE(SUM(t.amount), 0) FROM BankTransaction t
        WHERE t.bankAccountId = :bankAccountId AND t.date < :before
        """)
    BigDecimal sumAmountsBefore(@Param("bankAccountId") Long bankAccountId, @Param("before") LocalDate before);

    List<BankTransaction> findByBankAccountIdOrderByDateAscIdAsc(Long bankAccountId);

    List<BankTransaction> findByBankAccountIdAndDateGreaterThanEqualOrderByDateAscIdAsc(
        Long bankAccountId, LocalDate from);

    List<BankTransaction> findByBankAccountIdAndDateLessThanEqualOrderByDateAscIdAsc(
        Long bankAccountId, LocalDate to);

    List<BankTransaction> findByBankAccountIdAndDateBetweenOrderByDateAscIdAsc(
        Long bankAccountId, LocalDate from, LocalDate to);

    Optional<BankTransaction> findByPaymentId(Long paymentId);

    boolean existsByExpenseId(Long expenseId);

    /**
     * Unmatched transactions on other accounts with exactly the given amount.
     */
    @Query("""
        SELECT t FROM BankTransaction t
        WHERE t.bankAccountId <> :bankAccountId
          AND t.amount = :amount
          AND t.paymentId IS NULL AND t.expenseId IS NULL AND t.transferPairId IS NULL
        ORDER BY t.date ASC, t.id ASC
        """)
    List<BankTransaction> findTransferCandidates(@Param("bankAccountId") Long bankAccountId,
                                                 @Param("amount") BigDecimal amount);

    @Query("""
        SELECT t FROM BankTransaction t
        WHERE t.bankAccountId = :bankAccountId AND t.amount > 0
          AND t.paymentId IS NULL AND t.expenseId IS NULL AND t.transferPairId IS NULL
        ORDER BY t.date ASC, t.id ASC
        """)
    List<BankTransaction> findUnmatchedDeposits(@Param("bankAccountId") Long bankAccountId);

    @Query("""
        SELECT t FROM BankTransaction t
        WHERE t.bankAccountId = :bankAccountId AND t.amount < 0
          AND t.paymentId IS NULL AND t.expenseId IS NULL AND t.transferPairId IS NULL
        ORDER BY t.date ASC, t.id ASC
        """)
    List<BankTransaction> findUnmatchedWithdrawals(@Param("bankAccountId") Long bankAccountId);
}
