package com.ardua.ledger.ledger;

import com.ardua.ledger.config.LedgerProperties;
import com.ardua.ledger.exception.AccountInUseException;
import com.ardua.ledger.exception.InvalidConfigurationException;
import com.ardua.ledger.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Optional;

/**
 * Chart of accounts: creation, lookup, code allocation for bank accounts,
 * deactivation and restricted deletion.
 */
@Service
@Slf4j
public class ChartOfAccountsService {

    private static final String ACCOUNT_COLUMNS = "SELECT id, code, name, account_type, active FROM accounts ";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    public ChartOfAccountsService(JdbcTemplate jdbcTemplate, LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Transactional
    public Account createAccount(String code, String name, AccountType type) {
        if (name == null || name.isBlank() || name.length() > Account.MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                "Account name must be 1 to " + Account.MAX_NAME_LENGTH + " characters");
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO accounts (code, name, account_type, active) VALUES (?, ?, ?, TRUE)",
                new String[] {"id"});
            ps.setString(1, code);
            ps.setString(2, name);
            ps.setString(3, type.name());
            return ps;
        }, keyHolder);

        Long id = keyHolder.getKey().longValue();
        log.info("Created account {} '{}' ({})", code, name, type);
        return new Account(id, code, name, type, true);
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(Long id) {
        return jdbcTemplate.query(ACCOUNT_COLUMNS + "WHERE id = ?", accountRowMapper(), id)
            .stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Account getAccount(Long id) {
        return findById(id).orElseThrow(() -> new ResourceNotFoundException("Account", id));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByCode(String code) {
        return jdbcTemplate.query(ACCOUNT_COLUMNS + "WHERE code = ?", accountRowMapper(), code)
            .stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts() {
        return jdbcTemplate.query(ACCOUNT_COLUMNS + "ORDER BY code", accountRowMapper());
    }

    /**
     * Looks up one of the standard accounts the posting rules depend on.
     *
     * @throws InvalidConfigurationException when the chart has no such code
     */
    @Transactional(readOnly = true)
    public Account requireByCode(String code) {
        return findByCode(code).orElseThrow(() -> new InvalidConfigurationException(
            "Standard account " + code + " is missing from the chart of accounts"));
    }

    public Account cashAccount() {
        return requireByCode(properties.getAccounts().getCash());
    }

    public Account accountsReceivable() {
        return requireByCode(properties.getAccounts().getAccountsReceivable());
    }

    public Account unappliedPayments() {
        return requireByCode(properties.getAccounts().getUnappliedPayments());
    }

    public Account ownerEquity() {
        return requireByCode(properties.getAccounts().getOwnerEquity());
    }

    public Account revenue() {
        return requireByCode(properties.getAccounts().getRevenue());
    }

    /**
     * Next free code in the bank account range: highest existing code in the
     * range plus one, or the floor when the range is empty. Runs inside the
     * creating transaction; the unique constraint on {@code accounts.code}
     * rejects a concurrent duplicate.
     *
     * @throws InvalidConfigurationException if the highest code in the range
     *         is not numeric, or the range is used up
     */
    @Transactional(readOnly = true)
    public String nextBankAccountCode() {
        int floor = properties.getBankAccountCodes().getFloor();
        int ceiling = properties.getBankAccountCodes().getCeiling();

        List<String> highest = jdbcTemplate.queryForList(
            "SELECT code FROM accounts WHERE code >= ? AND code <= ? ORDER BY code DESC LIMIT 1",
            String.class, String.valueOf(floor), String.valueOf(ceiling));

        if (highest.isEmpty()) {
            return String.valueOf(floor);
        }

        String code = highest.get(0);
        int next;
        try {
            next = Integer.parseInt(code) + 1;
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                "Non-numeric account code '" + code + "' in the bank account range " + floor + "-" + ceiling);
        }
        if (next > ceiling) {
            throw new InvalidConfigurationException(
                "Bank account code range " + floor + "-" + ceiling + " is exhausted");
        }
        return String.valueOf(next);
    }

    @Transactional
    public Account deactivate(Long id) {
        Account account = getAccount(id);
        jdbcTemplate.update("UPDATE accounts SET active = FALSE WHERE id = ?", id);
        log.info("Deactivated account {}", account.getCode());
        return new Account(account.getId(), account.getCode(), account.getName(), account.getType(), false);
    }

    /**
     * Removes an account nothing refers to.
     *
     * @throws AccountInUseException when a journal line, bank account or
     *         expense category still references it
     */
    @Transactional
    public void deleteAccount(Long id) {
        Account account = getAccount(id);
        try {
            jdbcTemplate.update("DELETE FROM accounts WHERE id = ?", id);
        } catch (DataIntegrityViolationException e) {
            throw new AccountInUseException(account.getCode(), e);
        }
        log.info("Deleted account {}", account.getCode());
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getString("code"),
            rs.getString("name"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getBoolean("active"));
    }
}
