package com.ardua.ledger.banking;

import com.ardua.ledger.exception.InvalidConfigurationException;
import com.ardua.ledger.exception.ResourceNotFoundException;
import com.ardua.ledger.ledger.Account;
import com.ardua.ledger.ledger.AccountType;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.ledger.JournalEntryRequest;
import com.ardua.ledger.ledger.LedgerService;
import com.ardua.ledger.ledger.SourceReference;
import com.ardua.ledger.ledger.SourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Opens bank, card and cash accounts together with their GL account and
 * opening-balance entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankAccountService {

    private final BankAccountRepository bankAccountRepository;
    private final ChartOfAccountsService chartOfAccounts;
    private final LedgerService ledgerService;

    /**
     * Allocates the next code in the bank range, creates the GL account, the
     * bank account row and, for a non-zero opening balance, the opening entry
     * against Owner Equity.
     *
     * @throws InvalidConfigurationException when no code can be allocated
     */
    @Transactional
    public BankAccount createBankAccount(BankAccountType type, String institution,
                                         String maskedNumber, BigDecimal openingBalance) {
        BigDecimal opening = openingBalance != null ? openingBalance : BigDecimal.ZERO;
        requireLength("Institution", institution, BankAccount.MAX_INSTITUTION_LENGTH);
        requireLength("Masked number", maskedNumber, BankAccount.MAX_MASKED_NUMBER_LENGTH);

        String code = chartOfAccounts.nextBankAccountCode();
        Account glAccount = chartOfAccounts.createAccount(
            code, institution + " (" + maskedNumber + ")", type.glAccountType());

        BankAccount bankAccount = bankAccountRepository.save(
            BankAccount.open(glAccount.getId(), type, institution, maskedNumber, opening));

        postOpeningBalance(bankAccount, glAccount);

        log.info("Opened bank account {} ({}, GL {}, opening={})",
            bankAccount.getId(), type, code, opening);
        return bankAccount;
    }

    @Transactional(readOnly = true)
    public BankAccount getBankAccount(Long bankAccountId) {
        return bankAccountRepository.findById(bankAccountId)
            .orElseThrow(() -> new ResourceNotFoundException("Bank account", bankAccountId));
    }

    @Transactional(readOnly = true)
    public List<BankAccount> listBankAccounts() {
        return bankAccountRepository.findAllByOrderByIdAsc();
    }

    /**
     * Asset accounts: a positive balance is Dr Bank / Cr Equity, a negative one
     * Dr Equity / Cr Bank. A card balance is money owed, so it is always
     * Dr Equity / Cr Card for its absolute value.
     */
    private Optional<JournalEntry> postOpeningBalance(BankAccount bankAccount, Account glAccount) {
        BigDecimal opening = bankAccount.getOpeningBalance();
        if (opening.signum() == 0) {
            return Optional.empty();
        }

        Long bankGl = glAccount.getId();
        Long equity = chartOfAccounts.ownerEquity().getId();
        boolean debitBank = glAccount.getType() == AccountType.ASSET && opening.signum() > 0;

        JournalEntry entry = ledgerService.postEntry(JournalEntryRequest.simple(
            "Opening balance for " + bankAccount.displayName(),
            null,
            SourceReference.of(SourceType.BANK_ACCOUNT, bankAccount.getId()),
            debitBank ? bankGl : equity,
            debitBank ? equity : bankGl,
            opening.abs()));
        return Optional.of(entry);
    }

    private static void requireLength(String field, String value, int max) {
        if (value == null || value.isBlank() || value.length() > max) {
            throw new IllegalArgumentException(field + " must be 1 to " + max + " characters");
        }
    }
}
