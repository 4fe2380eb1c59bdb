package com.ardua.ledger.billing;

import com.ardua.ledger.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Expense categories and expenses, as read by the bank transaction matcher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private final ExpenseCategoryRepository categoryRepository;
    private final ExpenseRepository expenseRepository;
    private final ClientRepository clientRepository;

    @Transactional
    public ExpenseCategory createCategory(String name, Long accountId, boolean billableByDefault) {
        ExpenseCategory category = categoryRepository.save(
            ExpenseCategory.create(name, accountId, billableByDefault));
        log.info("Created expense category '{}' (account={})", name, accountId);
        return category;
    }

    @Transactional
    public ExpenseCategory assignAccount(Long categoryId, Long accountId) {
        ExpenseCategory category = getCategory(categoryId);
        category.assignAccount(accountId);
        return categoryRepository.save(category);
    }

    /**
     * @param clientId null for overhead that is not billed to anyone
     */
    @Transactional
    public Expense createExpense(Long clientId, Long categoryId, LocalDate date, BigDecimal amount,
                                 String description, boolean billable) {
        getCategory(categoryId);
        if (clientId != null && !clientRepository.existsById(clientId)) {
            throw new ResourceNotFoundException("Client", clientId);
        }
        if (billable && clientId == null) {
            throw new IllegalArgumentException("A billable expense needs a client");
        }
        return expenseRepository.save(Expense.create(clientId, categoryId, date, amount, description, billable));
    }

    /**
     * Billable expenses of a client that no invoice line has picked up yet.
     */
    @Transactional(readOnly = true)
    public List<Expense> listUnbilledExpenses(Long clientId) {
        if (!clientRepository.existsById(clientId)) {
            throw new ResourceNotFoundException("Client", clientId);
        }
        return expenseRepository.findByClientIdAndBillableTrueAndInvoiceLineIdIsNull(clientId);
    }

    @Transactional(readOnly = true)
    public ExpenseCategory getCategory(Long categoryId) {
        return categoryRepository.findById(categoryId)
            .orElseThrow(() -> new ResourceNotFoundException("Expense category", categoryId));
    }

    @Transactional(readOnly = true)
    public Expense getExpense(Long expenseId) {
        return expenseRepository.findById(expenseId)
            .orElseThrow(() -> new ResourceNotFoundException("Expense", expenseId));
    }
}
