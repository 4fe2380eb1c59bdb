package com.ardua.ledger.api;

import com.ardua.ledger.api.dto.BankTransactionResponse;
import com.ardua.ledger.api.dto.BatchLinkRequest;
import com.ardua.ledger.banking.BatchMatchResult;
import com.ardua.ledger.banking.ReconciliationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @GetMapping("/{bankAccountId}/deposits")
    public List<BankTransactionResponse> unmatchedDeposits(@PathVariable("bankAccountId") Long bankAccountId) {
        return reconciliationService.unmatchedDeposits(bankAccountId).stream()
            .map(BankTransactionResponse::from)
            .toList();
    }

    @GetMapping("/{bankAccountId}/withdrawals")
    public List<BankTransactionResponse> unmatchedWithdrawals(@PathVariable("bankAccountId") Long bankAccountId) {
        return reconciliationService.unmatchedWithdrawals(bankAccountId).stream()
            .map(BankTransactionResponse::from)
            .toList();
    }

    @PostMapping("/expenses")
    public BatchMatchResult linkExpenses(@Valid @RequestBody BatchLinkRequest request) {
        return reconciliationService.linkExpenses(request.toMap());
    }

    @PostMapping("/payments")
    public BatchMatchResult linkPayments(@Valid @RequestBody BatchLinkRequest request) {
        return reconciliationService.linkPayments(request.toMap());
    }
}
