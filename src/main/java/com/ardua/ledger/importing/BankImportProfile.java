package com.ardua.ledger.importing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Column layout and sign convention of one bank account's CSV export.
 * Column indices are zero-based; {@code dateFormat} is a
 * {@link java.time.format.DateTimeFormatter} pattern.
 */
@Entity
@Table(name = "bank_import_profiles")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BankImportProfile {

    public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bank_account_id", nullable = false, unique = true, updatable = false)
    private Long bankAccountId;

    @Column(name = "date_column_index", nullable = false)
    private int dateColumnIndex;

    @Column(name = "description_column_index", nullable = false)
    private int descriptionColumnIndex;

    @Column(name = "amount_column_index", nullable = false)
    private int amountColumnIndex;

    @Column(name = "date_format", nullable = false, length = 50)
    private String dateFormat;

    @Enumerated(EnumType.STRING)
    @Column(name = "sign_rule", nullable = false, length = 30)
    private SignRule signRule;

    @Column(name = "skip_if_description_contains", length = 200)
    private String skipIfDescriptionContains;

    static BankImportProfile forAccount(Long bankAccountId) {
        BankImportProfile profile = new BankImportProfile();
        profile.bankAccountId = bankAccountId;
        return profile;
    }

    void configure(int dateColumn, int descriptionColumn, int amountColumn, String dateFormat,
                   SignRule signRule, String skipPhrase) {
        if (dateColumn < 0 || descriptionColumn < 0 || amountColumn < 0) {
            throw new IllegalArgumentException("Column indices must be zero or greater");
        }
        this.dateColumnIndex = dateColumn;
        this.descriptionColumnIndex = descriptionColumn;
        this.amountColumnIndex = amountColumn;
        this.dateFormat = dateFormat != null && !dateFormat.isBlank() ? dateFormat : DEFAULT_DATE_FORMAT;
        this.signRule = signRule;
        this.skipIfDescriptionContains = skipPhrase != null && !skipPhrase.isBlank() ? skipPhrase : null;
    }

    public int highestColumnIndex() {
        return Math.max(dateColumnIndex, Math.max(descriptionColumnIndex, amountColumnIndex));
    }

    /**
     * Case-insensitive substring test against the configured skip phrase.
     */
    public boolean skips(String description) {
        return skipIfDescriptionContains != null
            && description.toLowerCase().contains(skipIfDescriptionContains.toLowerCase());
    }
}
