package com.ardua.ledger.importing;

import com.ardua.ledger.banking.BankAccount;
import com.ardua.ledger.banking.BankAccountService;
import com.ardua.ledger.exception.InvalidConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.format.DateTimeFormatter;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ImportProfileService {

    private final BankImportProfileRepository profileRepository;
    private final BankAccountService bankAccountService;

    /**
     * Creates or replaces the import profile of a bank account. Checking and
     * savings accounts default to {@link SignRule#BANK_STANDARD}; card and
     * cash accounts must name their rule.
     *
     * @throws InvalidConfigurationException when the rule is missing for a
     *         card or cash account, or the date pattern is invalid
     */
    @Transactional
    public BankImportProfile saveProfile(Long bankAccountId, int dateColumn, int descriptionColumn,
                                         int amountColumn, String dateFormat, SignRule signRule,
                                         String skipPhrase) {
        BankAccount bankAccount = bankAccountService.getBankAccount(bankAccountId);
        SignRule rule = signRule != null ? signRule : defaultRule(bankAccount);

        if (dateFormat != null && !dateFormat.isBlank()) {
            try {
                DateTimeFormatter.ofPattern(dateFormat);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("Invalid date format '" + dateFormat + "': " + e.getMessage());
            }
        }

        BankImportProfile profile = profileRepository.findByBankAccountId(bankAccountId)
            .orElseGet(() -> BankImportProfile.forAccount(bankAccountId));
        profile.configure(dateColumn, descriptionColumn, amountColumn, dateFormat, rule, skipPhrase);
        profile = profileRepository.save(profile);

        log.info("Saved import profile for bank account {}: rule={}, date format={}",
            bankAccountId, rule, profile.getDateFormat());
        return profile;
    }

    @Transactional(readOnly = true)
    public Optional<BankImportProfile> findProfile(Long bankAccountId) {
        return profileRepository.findByBankAccountId(bankAccountId);
    }

    private SignRule defaultRule(BankAccount bankAccount) {
        return switch (bankAccount.getType()) {
            case CHECKING, SAVINGS -> SignRule.BANK_STANDARD;
            case CREDIT_CARD, CASH -> throw new InvalidConfigurationException(
                bankAccount.getType() + " import profiles must specify a sign rule");
        };
    }
}
