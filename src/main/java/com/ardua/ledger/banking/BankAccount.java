package com.ardua.ledger.banking;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Bank, card or cash account, wrapping exactly one GL account.
 * {@code openingBalance} is fixed at creation; the current balance is always
 * derived from the transactions.
 */
@Entity
@Table(name = "bank_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BankAccount {

    public static final int MAX_INSTITUTION_LENGTH = 255;
    public static final int MAX_MASKED_NUMBER_LENGTH = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, unique = true, updatable = false)
    private Long accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 20, updatable = false)
    private BankAccountType type;

    @Column(nullable = false)
    private String institution;

    @Column(name = "masked_number", nullable = false, length = 20)
    private String maskedNumber;

    @Column(name = "opening_balance", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal openingBalance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BankAccount open(Long accountId, BankAccountType type, String institution,
                            String maskedNumber, BigDecimal openingBalance) {
        BankAccount account = new BankAccount();
        account.accountId = accountId;
        account.type = type;
        account.institution = institution;
        account.maskedNumber = maskedNumber;
        account.openingBalance = openingBalance;
        return account;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public String displayName() {
        return institution + " (" + maskedNumber + ")";
    }
}
