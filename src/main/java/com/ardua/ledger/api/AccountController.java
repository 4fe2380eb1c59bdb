package com.ardua.ledger.api;

import com.ardua.ledger.api.dto.CreateAccountRequest;
import com.ardua.ledger.ledger.Account;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.ledger.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chart of accounts.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final ChartOfAccountsService chartOfAccounts;
    private final LedgerService ledgerService;

    @GetMapping
    public List<Account> listAccounts() {
        return chartOfAccounts.listAccounts();
    }

    @PostMapping
    public ResponseEntity<Account> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = chartOfAccounts.createAccount(request.getCode(), request.getName(), request.getType());
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping("/{id}/balance")
    public Map<String, Object> getBalance(@PathVariable("id") Long id) {
        Account account = chartOfAccounts.getAccount(id);
        BigDecimal balance = ledgerService.getAccountBalance(id);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("account_id", account.getId());
        response.put("code", account.getCode());
        response.put("balance", balance);
        return response;
    }

    @PostMapping("/{id}/deactivate")
    public Account deactivate(@PathVariable("id") Long id) {
        return chartOfAccounts.deactivate(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable("id") Long id) {
        chartOfAccounts.deleteAccount(id);
        return ResponseEntity.noContent().build();
    }
}
