package com.ardua.ledger.importing;

import com.ardua.ledger.banking.BankTransaction;
import com.ardua.ledger.banking.BankTransactionService;
import com.ardua.ledger.exception.InvalidConfigurationException;
import com.ardua.ledger.exception.StatementImportException;
import com.ardua.ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports a bank's CSV export through the account's import profile.
 *
 * Rows are skipped when empty, when the date cell does not start with a digit
 * (header and footer lines), when the description contains the profile's skip
 * phrase, or when the amount is zero. Every other row is posted against the
 * given offset account. The import is all or nothing: the first bad row rolls
 * back every row before it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvStatementImportService {

    private static final CSVFormat STATEMENT_FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreEmptyLines(false)
        .setTrim(true)
        .build();

    private final ImportProfileService profileService;
    private final BankTransactionService bankTransactionService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @throws InvalidConfigurationException if the account has no import profile
     * @throws StatementImportException on the first row that cannot be parsed
     */
    @Transactional
    public ImportResult importStatement(Long bankAccountId, Reader csv, Long offsetAccountId) {
        long started = System.nanoTime();
        BankImportProfile profile = profileService.findProfile(bankAccountId)
            .orElseThrow(() -> new InvalidConfigurationException(
                "No import profile defined for bank account " + bankAccountId));
        DateTimeFormatter dateFormatter = DateTimeFormatter.ofPattern(profile.getDateFormat());

        List<Long> imported = new ArrayList<>();
        int skipped = 0;
        long rowNumber = 0;

        try (CSVParser parser = CSVParser.parse(csv, STATEMENT_FORMAT)) {
            for (CSVRecord record : parser) {
                rowNumber = record.getRecordNumber();
                StatementRow row = readRow(record, profile, dateFormatter);
                if (row == null) {
                    skipped++;
                    continue;
                }
                BankTransaction txn = bankTransactionService.postTransaction(
                    bankAccountId, row.date, row.description, row.amount, offsetAccountId);
                imported.add(txn.getId());
            }
        } catch (IOException | UncheckedIOException e) {
            throw new StatementImportException(rowNumber + 1, "unreadable CSV input", e);
        }

        ledgerMetrics.recordImportedRows(imported.size(), skipped);
        ledgerMetrics.recordOperation("csv_import", Duration.ofNanos(System.nanoTime() - started));
        log.info("Imported statement into bank account {}: imported={}, skipped={}",
            bankAccountId, imported.size(), skipped);
        return new ImportResult(imported, skipped);
    }

    /**
     * @return the parsed row, or null when the row is skipped
     */
    private StatementRow readRow(CSVRecord record, BankImportProfile profile, DateTimeFormatter dateFormatter) {
        long rowNumber = record.getRecordNumber();
        if (isBlank(record)) {
            return null;
        }
        if (record.size() <= profile.getDateColumnIndex()) {
            return null;
        }
        String rawDate = record.get(profile.getDateColumnIndex());
        if (rawDate.isEmpty() || !Character.isDigit(rawDate.charAt(0))) {
            return null;
        }
        if (record.size() <= profile.highestColumnIndex()) {
            throw new StatementImportException(rowNumber,
                "expected at least " + (profile.highestColumnIndex() + 1) + " columns, found " + record.size(), null);
        }

        String description = record.get(profile.getDescriptionColumnIndex());
        if (profile.skips(description)) {
            return null;
        }
        if (description.length() > BankTransaction.MAX_DESCRIPTION_LENGTH) {
            throw new StatementImportException(rowNumber,
                "description longer than " + BankTransaction.MAX_DESCRIPTION_LENGTH + " characters", null);
        }

        LocalDate date;
        try {
            date = LocalDate.parse(rawDate, dateFormatter);
        } catch (DateTimeParseException e) {
            throw new StatementImportException(rowNumber,
                "date '" + rawDate + "' does not match " + profile.getDateFormat(), e);
        }

        String rawAmount = record.get(profile.getAmountColumnIndex());
        BigDecimal amount;
        try {
            amount = new BigDecimal(rawAmount);
        } catch (NumberFormatException e) {
            throw new StatementImportException(rowNumber, "invalid amount '" + rawAmount + "'", e);
        }
        if (amount.signum() == 0) {
            log.debug("Skipping zero-amount row {}", rowNumber);
            return null;
        }

        return new StatementRow(date, description, profile.getSignRule().normalize(amount));
    }

    private static boolean isBlank(CSVRecord record) {
        for (String value : record) {
            if (!value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static final class StatementRow {
        private final LocalDate date;
        private final String description;
        private final BigDecimal amount;

        private StatementRow(LocalDate date, String description, BigDecimal amount) {
            this.date = date;
            this.description = description;
            this.amount = amount;
        }
    }
}
