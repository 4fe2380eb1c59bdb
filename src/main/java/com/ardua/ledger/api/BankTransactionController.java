package com.ardua.ledger.api;

import com.ardua.ledger.api.dto.AccountRequest;
import com.ardua.ledger.api.dto.AllocationRequest;
import com.ardua.ledger.api.dto.BankTransactionResponse;
import com.ardua.ledger.api.dto.ExpenseResponse;
import com.ardua.ledger.api.dto.JournalEntryResponse;
import com.ardua.ledger.api.dto.LinkRequest;
import com.ardua.ledger.api.dto.PaymentFromTransactionRequest;
import com.ardua.ledger.api.dto.PaymentResponse;
import com.ardua.ledger.api.dto.TransferMatchRequest;
import com.ardua.ledger.banking.BankTransactionService;
import com.ardua.ledger.banking.ReconciliationService;
import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.payment.Payment;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retagging and matching of individual bank transactions.
 */
@RestController
@RequestMapping("/api/bank-transactions")
@RequiredArgsConstructor
public class BankTransactionController {

    private final BankTransactionService bankTransactionService;
    private final ReconciliationService reconciliationService;

    @GetMapping("/{id}")
    public BankTransactionResponse getTransaction(@PathVariable("id") Long id) {
        return BankTransactionResponse.from(bankTransactionService.getTransaction(id));
    }

    @PostMapping("/{id}/retag")
    public BankTransactionResponse retag(@PathVariable("id") Long id, @Valid @RequestBody AccountRequest request) {
        return BankTransactionResponse.from(bankTransactionService.retagTransaction(id, request.getAccountId()));
    }

    @PostMapping("/{id}/owner-equity")
    public BankTransactionResponse markAsOwnerEquity(@PathVariable("id") Long id) {
        return BankTransactionResponse.from(bankTransactionService.markAsOwnerEquity(id));
    }

    @PostMapping("/{id}/expense")
    public ExpenseResponse linkExpense(@PathVariable("id") Long id, @Valid @RequestBody LinkRequest request) {
        return ExpenseResponse.from(bankTransactionService.linkExpense(id, request.getTargetId()));
    }

    /**
     * Target is the expense category of the expense created from the transaction.
     */
    @PostMapping("/{id}/new-expense")
    public ResponseEntity<ExpenseResponse> createAndLinkExpense(@PathVariable("id") Long id,
                                                                @Valid @RequestBody LinkRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ExpenseResponse.from(bankTransactionService.createAndLinkExpense(id, request.getTargetId())));
    }

    @PostMapping("/{id}/payment")
    public PaymentResponse linkPayment(@PathVariable("id") Long id, @Valid @RequestBody LinkRequest request) {
        Payment payment = bankTransactionService.linkExistingPayment(id, request.getTargetId());
        return PaymentResponse.from(payment, true);
    }

    @PostMapping("/{id}/new-payment")
    public ResponseEntity<PaymentResponse> createPayment(@PathVariable("id") Long id,
                                                         @Valid @RequestBody PaymentFromTransactionRequest request) {
        Payment payment = bankTransactionService.createPaymentFromTransaction(id, request.getClientId(),
            request.getMethod(), request.getMemo(), AllocationRequest.toAllocations(request.getAllocations()));
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment, true));
    }

    @PostMapping("/{id}/unmatch")
    public BankTransactionResponse unmatch(@PathVariable("id") Long id, @Valid @RequestBody AccountRequest request) {
        return BankTransactionResponse.from(bankTransactionService.unmatchTransaction(id, request.getAccountId()));
    }

    @PostMapping("/transfers")
    public JournalEntryResponse matchTransfer(@Valid @RequestBody TransferMatchRequest request) {
        JournalEntry entry = bankTransactionService.matchTransfer(
            request.getFirstTransactionId(), request.getSecondTransactionId());
        return JournalEntryResponse.from(entry);
    }

    /**
     * Match suggestions of every kind for one transaction.
     */
    @GetMapping("/{id}/candidates")
    public Map<String, Object> candidates(@PathVariable("id") Long id) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("payments", reconciliationService.paymentCandidates(id).stream()
            .map(payment -> PaymentResponse.from(payment, false))
            .toList());
        response.put("expenses", reconciliationService.expenseCandidates(id).stream()
            .map(ExpenseResponse::from)
            .toList());
        response.put("transfers", reconciliationService.transferCandidates(id).stream()
            .map(BankTransactionResponse::from)
            .toList());
        return response;
    }
}
