package com.ardua.ledger.support;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Empties every table between tests, keeping the seeded chart of accounts.
 */
public final class DatabaseCleaner {

    private static final String[] TABLES_IN_DELETE_ORDER = {
        "outbox_events",
        "bank_import_profiles",
        "bank_transactions",
        "payment_applications",
        "payments",
        "expenses",
        "invoice_lines",
        "invoices",
        "expense_categories",
        "bank_accounts",
        "clients",
        "journal_lines",
        "journal_entries"
    };

    private DatabaseCleaner() {
    }

    public static void reset(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.update("UPDATE bank_transactions SET transfer_pair_id = NULL");
        for (String table : TABLES_IN_DELETE_ORDER) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
        jdbcTemplate.update("DELETE FROM accounts WHERE code NOT IN ('1000', '1100', '2200', '3000', '4000')");
    }
}
