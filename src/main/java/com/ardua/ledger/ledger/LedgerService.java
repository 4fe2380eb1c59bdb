package com.ardua.ledger.ledger;

import com.ardua.ledger.event.JournalEntryPostedEvent;
import com.ardua.ledger.event.JournalEntryRemovedEvent;
import com.ardua.ledger.exception.ResourceNotFoundException;
import com.ardua.ledger.exception.UnbalancedEntryException;
import com.ardua.ledger.observability.CorrelationContext;
import com.ardua.ledger.observability.LedgerMetrics;
import com.ardua.ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes and reads the journal.
 *
 * Every write checks that debits equal credits before touching the database,
 * runs in the caller's transaction, and records a ledger event in the outbox.
 * Balances are always derived from journal lines; nothing here caches them.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String ENTRY_COLUMNS =
        "SELECT id, posted_at, posted_by, description, source_type, source_id FROM journal_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    public LedgerService(JdbcTemplate jdbcTemplate, OutboxService outboxService,
                         LedgerMetrics ledgerMetrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
    }

    /**
     * Creates a journal entry with the request's lines.
     *
     * @throws UnbalancedEntryException if debits and credits differ
     * @throws ResourceNotFoundException if a line references an unknown account
     */
    @Transactional
    public JournalEntry postEntry(JournalEntryRequest request) {
        requireBalanced(request);
        validateAccountsExist(request);

        LocalDateTime postedAt = request.getPostedAt() != null ? request.getPostedAt() : LocalDateTime.now(clock);
        SourceReference source = request.getSource();

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO journal_entries (posted_at, posted_by, description, source_type, source_id) " +
                "VALUES (?, ?, ?, ?, ?)",
                new String[] {"id"});
            ps.setTimestamp(1, Timestamp.valueOf(postedAt));
            ps.setString(2, request.getPostedBy());
            ps.setString(3, request.getDescription() != null ? request.getDescription() : "");
            if (source != null) {
                ps.setString(4, source.getType().name());
                ps.setLong(5, source.getId());
            } else {
                ps.setNull(4, Types.VARCHAR);
                ps.setNull(5, Types.BIGINT);
            }
            return ps;
        }, keyHolder);

        Long entryId = keyHolder.getKey().longValue();
        insertLines(entryId, request);

        JournalEntry entry = getEntry(entryId);
        MDC.put(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            log.info("Posted journal entry: source={}, amount={}, lines={}",
                source, entry.getTotalDebits(), entry.getLines().size());
        } finally {
            MDC.remove(CorrelationContext.JOURNAL_ENTRY_ID_MDC_KEY);
        }

        outboxService.saveEvent(JournalEntryPostedEvent.posted(entry, clock.instant()));
        ledgerMetrics.recordEntryPosted(sourceTag(source));
        return entry;
    }

    /**
     * Rebuilds the lines of an existing entry in place. The entry id, posting
     * date and source reference stay as they were.
     */
    @Transactional
    public JournalEntry replaceLines(Long entryId, JournalEntryRequest request) {
        requireBalanced(request);
        validateAccountsExist(request);
        JournalEntry existing = getEntry(entryId);

        jdbcTemplate.update("DELETE FROM journal_lines WHERE entry_id = ?", entryId);
        insertLines(entryId, request);
        if (request.getDescription() != null) {
            jdbcTemplate.update("UPDATE journal_entries SET description = ? WHERE id = ?",
                request.getDescription(), entryId);
        }

        JournalEntry entry = getEntry(entryId);
        log.info("Replaced lines of journal entry {}: {} -> {} lines",
            entryId, existing.getLines().size(), entry.getLines().size());

        outboxService.saveEvent(JournalEntryPostedEvent.linesReplaced(entry, clock.instant()));
        return entry;
    }

    /**
     * Deletes a superseded entry; its lines go with it.
     */
    @Transactional
    public void deleteEntry(Long entryId) {
        JournalEntry entry = getEntry(entryId);
        jdbcTemplate.update("DELETE FROM journal_entries WHERE id = ?", entryId);

        log.info("Deleted journal entry {} (source={})", entryId, entry.getSource());
        outboxService.saveEvent(JournalEntryRemovedEvent.of(entry, clock.instant()));
        ledgerMetrics.recordEntryRemoved(sourceTag(entry.getSource()));
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findEntry(Long entryId) {
        List<JournalEntry> found = jdbcTemplate.query(
            ENTRY_COLUMNS + "WHERE id = ?", entryRowMapper(), entryId);
        return found.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(Long entryId) {
        return findEntry(entryId)
            .orElseThrow(() -> new ResourceNotFoundException("Journal entry", entryId));
    }

    /**
     * All entries for a document, oldest first.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> findEntriesForSource(SourceReference source) {
        return jdbcTemplate.query(
            ENTRY_COLUMNS + "WHERE source_type = ? AND source_id = ? ORDER BY id",
            entryRowMapper(), source.getType().name(), source.getId());
    }

    @Transactional(readOnly = true)
    public int countEntriesForSource(SourceReference source) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE source_type = ? AND source_id = ?",
            Integer.class, source.getType().name(), source.getId());
        return count != null ? count : 0;
    }

    /**
     * Signed balance on the account's normal side: debits minus credits for
     * assets and expenses, credits minus debits for everything else.
     */
    @Transactional(readOnly = true)
    public BigDecimal getAccountBalance(Long accountId) {
        List<String> types = jdbcTemplate.queryForList(
            "SELECT account_type FROM accounts WHERE id = ?", String.class, accountId);
        if (types.isEmpty()) {
            throw new ResourceNotFoundException("Account", accountId);
        }
        AccountType type = AccountType.valueOf(types.get(0));

        BigDecimal debitMinusCredit = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit - credit), 0) FROM journal_lines WHERE account_id = ?",
            BigDecimal.class, accountId);
        if (debitMinusCredit == null) {
            debitMinusCredit = BigDecimal.ZERO;
        }
        return type.isDebitNormal() ? debitMinusCredit : debitMinusCredit.negate();
    }

    /**
     * Global debit and credit totals; they agree whenever the journal is consistent.
     */
    @Transactional(readOnly = true)
    public JournalTotals journalTotals() {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS debits, COALESCE(SUM(credit), 0) AS credits FROM journal_lines",
            (rs, rowNum) -> new JournalTotals(rs.getBigDecimal("debits"), rs.getBigDecimal("credits")));
    }

    private void requireBalanced(JournalEntryRequest request) {
        if (request.getDebits().isEmpty() || request.getCredits().isEmpty() || !request.isBalanced()) {
            throw new UnbalancedEntryException(request.getDebitTotal(), request.getCreditTotal());
        }
    }

    private void insertLines(Long entryId, JournalEntryRequest request) {
        for (JournalEntryRequest.DebitCredit debit : request.getDebits()) {
            insertLine(entryId, debit.getAccountId(), debit.getAmount(), BigDecimal.ZERO);
        }
        for (JournalEntryRequest.DebitCredit credit : request.getCredits()) {
            insertLine(entryId, credit.getAccountId(), BigDecimal.ZERO, credit.getAmount());
        }
    }

    private void insertLine(Long entryId, Long accountId, BigDecimal debit, BigDecimal credit) {
        jdbcTemplate.update(
            "INSERT INTO journal_lines (entry_id, account_id, debit, credit) VALUES (?, ?, ?, ?)",
            entryId, accountId, debit, credit);
    }

    private void validateAccountsExist(JournalEntryRequest request) {
        Set<Long> accountIds = new LinkedHashSet<>();
        request.getDebits().forEach(line -> accountIds.add(line.getAccountId()));
        request.getCredits().forEach(line -> accountIds.add(line.getAccountId()));

        for (Long accountId : accountIds) {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM accounts WHERE id = ?", Integer.class, accountId);
            if (count == null || count == 0) {
                throw new ResourceNotFoundException("Account", accountId);
            }
        }
    }

    private List<JournalLine> linesFor(Long entryId) {
        return jdbcTemplate.query(
            "SELECT id, entry_id, account_id, debit, credit FROM journal_lines WHERE entry_id = ? ORDER BY id",
            (rs, rowNum) -> new JournalLine(
                rs.getLong("id"),
                rs.getLong("entry_id"),
                rs.getLong("account_id"),
                rs.getBigDecimal("debit"),
                rs.getBigDecimal("credit")),
            entryId);
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            long id = rs.getLong("id");
            String sourceType = rs.getString("source_type");
            long sourceId = rs.getLong("source_id");
            SourceReference source = sourceType != null && !rs.wasNull()
                ? SourceReference.of(SourceType.valueOf(sourceType), sourceId)
                : null;
            return new JournalEntry(
                id,
                rs.getTimestamp("posted_at").toLocalDateTime(),
                rs.getString("posted_by"),
                rs.getString("description"),
                source,
                new ArrayList<>(linesFor(id)));
        };
    }

    private static String sourceTag(SourceReference source) {
        return source != null ? source.getType().name() : "MANUAL";
    }
}
