package com.ardua.ledger.billing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface ExpenseRepository extends JpaRepository<Expense, Long> {

    /**
     * Expenses not yet paid from any bank account, for reconciliation candidates.
     */
    List<Expense> findByPaymentAccountIdIsNullAndAmountOrderByExpenseDateAsc(BigDecimal amount);

    List<Expense> findByClientIdAndBillableTrueAndInvoiceLineIdIsNull(Long clientId);
}
