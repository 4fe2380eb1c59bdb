package com.ardua.ledger.api;

import com.ardua.ledger.api.dto.AssignAccountRequest;
import com.ardua.ledger.api.dto.CreateClientRequest;
import com.ardua.ledger.api.dto.CreateExpenseCategoryRequest;
import com.ardua.ledger.api.dto.CreateExpenseRequest;
import com.ardua.ledger.api.dto.ExpenseResponse;
import com.ardua.ledger.api.dto.PaymentResponse;
import com.ardua.ledger.billing.Client;
import com.ardua.ledger.billing.ClientService;
import com.ardua.ledger.billing.ExpenseCategory;
import com.ardua.ledger.billing.ExpenseService;
import com.ardua.ledger.payment.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Clients, expense categories and expenses, plus the per-client payment and unbilled expense lists.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ClientController {

    private static final int DEFAULT_PAYMENT_TERMS_DAYS = 30;

    private final ClientService clientService;
    private final ExpenseService expenseService;
    private final PaymentService paymentService;

    @GetMapping("/clients")
    public List<Client> listClients() {
        return clientService.listClients();
    }

    @PostMapping("/clients")
    public ResponseEntity<Client> createClient(@Valid @RequestBody CreateClientRequest request) {
        int terms = request.getPaymentTermsDays() != null ? request.getPaymentTermsDays() : DEFAULT_PAYMENT_TERMS_DAYS;
        return ResponseEntity.status(HttpStatus.CREATED).body(clientService.createClient(request.getName(), terms));
    }

    @GetMapping("/clients/{id}")
    public Client getClient(@PathVariable("id") Long clientId) {
        return clientService.getClient(clientId);
    }

    @GetMapping("/clients/{id}/payments")
    public List<PaymentResponse> listPayments(@PathVariable("id") Long clientId) {
        return paymentService.listPaymentsForClient(clientId).stream()
            .map(payment -> PaymentResponse.from(payment, paymentService.isPosted(payment.getId())))
            .toList();
    }

    @GetMapping("/clients/{id}/unbilled-expenses")
    public List<ExpenseResponse> listUnbilledExpenses(@PathVariable("id") Long clientId) {
        return expenseService.listUnbilledExpenses(clientId).stream()
            .map(ExpenseResponse::from)
            .toList();
    }

    @PostMapping("/expense-categories")
    public ResponseEntity<ExpenseCategory> createCategory(@Valid @RequestBody CreateExpenseCategoryRequest request) {
        ExpenseCategory category = expenseService.createCategory(
            request.getName(), request.getAccountId(), request.isBillableByDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(category);
    }

    /**
     * Points a category at its GL account so bank transactions can be linked to its expenses.
     */
    @PutMapping("/expense-categories/{id}/account")
    public ExpenseCategory assignAccount(@PathVariable("id") Long categoryId,
                                         @Valid @RequestBody AssignAccountRequest request) {
        return expenseService.assignAccount(categoryId, request.getAccountId());
    }

    @PostMapping("/expenses")
    public ResponseEntity<ExpenseResponse> createExpense(@Valid @RequestBody CreateExpenseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expenseService.createExpense(
            request.getClientId(), request.getCategoryId(), request.getDate(), request.getAmount(),
            request.getDescription(), request.isBillable())));
    }
}
