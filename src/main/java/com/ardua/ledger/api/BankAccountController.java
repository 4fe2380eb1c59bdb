package com.ardua.ledger.api;

import com.ardua.ledger.api.dto.BankAccountResponse;
import com.ardua.ledger.api.dto.BankTransactionResponse;
import com.ardua.ledger.api.dto.CreateBankAccountRequest;
import com.ardua.ledger.api.dto.ImportProfileRequest;
import com.ardua.ledger.api.dto.ImportResultResponse;
import com.ardua.ledger.api.dto.PostTransactionRequest;
import com.ardua.ledger.banking.BankAccount;
import com.ardua.ledger.banking.BankAccountService;
import com.ardua.ledger.banking.BankTransaction;
import com.ardua.ledger.banking.BankTransactionService;
import com.ardua.ledger.importing.BankImportProfile;
import com.ardua.ledger.importing.CsvStatementImportService;
import com.ardua.ledger.importing.ImportProfileService;
import com.ardua.ledger.importing.ImportResult;
import com.ardua.ledger.reporting.BalanceService;
import com.ardua.ledger.reporting.BankRegister;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

/**
 * Bank accounts, their registers and statement imports.
 */
@RestController
@RequestMapping("/api/bank-accounts")
@RequiredArgsConstructor
@Slf4j
public class BankAccountController {

    private final BankAccountService bankAccountService;
    private final BankTransactionService bankTransactionService;
    private final BalanceService balanceService;
    private final ImportProfileService importProfileService;
    private final CsvStatementImportService importService;

    @PostMapping
    public ResponseEntity<BankAccountResponse> createBankAccount(@Valid @RequestBody CreateBankAccountRequest request) {
        BankAccount account = bankAccountService.createBankAccount(
            request.getType(), request.getInstitution(), request.getMaskedNumber(), request.getOpeningBalance());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(BankAccountResponse.from(account, balanceService.bankAccountBalance(account.getId())));
    }

    @GetMapping
    public List<BankAccountResponse> listBankAccounts() {
        return bankAccountService.listBankAccounts().stream()
            .map(account -> BankAccountResponse.from(account, balanceService.bankAccountBalance(account.getId())))
            .toList();
    }

    @GetMapping("/{id}")
    public BankAccountResponse getBankAccount(@PathVariable("id") Long id) {
        return BankAccountResponse.from(bankAccountService.getBankAccount(id), balanceService.bankAccountBalance(id));
    }

    @GetMapping("/{id}/register")
    public BankRegister getRegister(
            @PathVariable("id") Long id,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return balanceService.runningBalanceForRange(id, from, to);
    }

    @GetMapping("/{id}/transactions")
    public List<BankTransactionResponse> listTransactions(@PathVariable("id") Long id) {
        return bankTransactionService.listTransactions(id).stream()
            .map(BankTransactionResponse::from)
            .toList();
    }

    @PostMapping("/{id}/transactions")
    public ResponseEntity<BankTransactionResponse> postTransaction(@PathVariable("id") Long id,
                                                                   @Valid @RequestBody PostTransactionRequest request) {
        BankTransaction txn = bankTransactionService.postTransaction(
            id, request.getDate(), request.getDescription(), request.getAmount(), request.getOffsetAccountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(BankTransactionResponse.from(txn));
    }

    @PutMapping("/{id}/import-profile")
    public BankImportProfile saveImportProfile(@PathVariable("id") Long id,
                                               @Valid @RequestBody ImportProfileRequest request) {
        return importProfileService.saveProfile(id, request.getDateColumn(), request.getDescriptionColumn(),
            request.getAmountColumn(), request.getDateFormat(), request.getSignRule(),
            request.getSkipIfDescriptionContains());
    }

    /**
     * Imports a CSV statement file; all rows are posted or none are.
     */
    @PostMapping(value = "/{id}/transactions/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportResultResponse> importStatement(
            @PathVariable("id") Long id,
            @RequestPart("file") MultipartFile file,
            @RequestParam("offset_account_id") Long offsetAccountId) throws IOException {
        log.info("Received statement import for bank account {}: file={}, size={}",
            id, file.getOriginalFilename(), file.getSize());
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            ImportResult result = importService.importStatement(id, reader, offsetAccountId);
            return ResponseEntity.status(HttpStatus.CREATED).body(ImportResultResponse.from(result));
        }
    }
}
