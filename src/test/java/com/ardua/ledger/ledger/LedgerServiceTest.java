package com.ardua.ledger.ledger;

import com.ardua.ledger.event.JournalEntryPostedEvent;
import com.ardua.ledger.event.JournalEntryRemovedEvent;
import com.ardua.ledger.exception.ResourceNotFoundException;
import com.ardua.ledger.exception.UnbalancedEntryException;
import com.ardua.ledger.outbox.OutboxEventRepository;
import com.ardua.ledger.support.DatabaseCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the journal: unbalanced entries, unknown accounts, bad lines.
 */
@SpringBootTest
@ActiveProfiles("test")
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long cashId;
    private Long revenueId;
    private Long suppliesId;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbcTemplate);
        cashId = chartOfAccounts.cashAccount().getId();
        revenueId = chartOfAccounts.revenue().getId();
        suppliesId = chartOfAccounts.createAccount("6100", "Office Supplies", AccountType.EXPENSE).getId();
    }

    @Test
    @DisplayName("Balanced entry is stored with its lines and source")
    void postsBalancedEntry() {
        // Given
        SourceReference source = SourceReference.of(SourceType.INVOICE, 42L);
        JournalEntryRequest request = JournalEntryRequest.simple(
            "Consulting", "alice", source, cashId, revenueId, new BigDecimal("100.00"));

        // When
        JournalEntry entry = ledgerService.postEntry(request);

        // Then
        assertNotNull(entry.getId());
        assertEquals(2, entry.getLines().size());
        assertTrue(entry.isBalanced());
        assertEquals("alice", entry.getPostedBy());
        assertEquals(source, entry.getSource());
        assertEquals(0, entry.debitsTo(cashId).compareTo(new BigDecimal("100.00")));
        assertEquals(0, entry.creditsTo(revenueId).compareTo(new BigDecimal("100.00")));
        assertEquals(1, ledgerService.countEntriesForSource(source));
    }

    @Test
    @DisplayName("Balances follow each account's normal side")
    void balancesUseNormalSide() {
        // Given
        ledgerService.postEntry(JournalEntryRequest.simple(
            "Invoice", null, null, cashId, revenueId, new BigDecimal("100.00")));
        ledgerService.postEntry(JournalEntryRequest.simple(
            "Supplies", null, null, suppliesId, cashId, new BigDecimal("30.00")));

        // Then
        assertEquals(0, ledgerService.getAccountBalance(cashId).compareTo(new BigDecimal("70.00")));
        assertEquals(0, ledgerService.getAccountBalance(revenueId).compareTo(new BigDecimal("100.00")),
            "Income is credit-normal");
        assertEquals(0, ledgerService.getAccountBalance(suppliesId).compareTo(new BigDecimal("30.00")),
            "Expense is debit-normal");
        assertTrue(ledgerService.journalTotals().isBalanced());
    }

    @Test
    @DisplayName("Unbalanced entry is rejected before anything is written")
    void rejectsUnbalancedEntry() {
        // Given
        JournalEntryRequest request = new JournalEntryRequest("Broken", null, null,
            List.of(JournalEntryRequest.DebitCredit.of(cashId, new BigDecimal("100.00"))),
            List.of(JournalEntryRequest.DebitCredit.of(revenueId, new BigDecimal("50.00"))));

        // When/Then
        UnbalancedEntryException exception = assertThrows(UnbalancedEntryException.class,
            () -> ledgerService.postEntry(request));
        assertTrue(exception.getMessage().contains("debits=100.00"));
        assertEquals(0, countRows("journal_entries"));
    }

    @Test
    @DisplayName("Entry with an empty side is rejected")
    void rejectsOneSidedEntry() {
        JournalEntryRequest request = new JournalEntryRequest("One sided", null, null,
            List.of(JournalEntryRequest.DebitCredit.of(cashId, new BigDecimal("10.00"))),
            List.of());

        assertThrows(UnbalancedEntryException.class, () -> ledgerService.postEntry(request));
    }

    @Test
    @DisplayName("Unknown account is rejected")
    void rejectsUnknownAccount() {
        JournalEntryRequest request = JournalEntryRequest.simple(
            "Ghost", null, null, cashId, 999_999L, new BigDecimal("10.00"));

        assertThrows(ResourceNotFoundException.class, () -> ledgerService.postEntry(request));
        assertEquals(0, countRows("journal_entries"));
    }

    @Test
    @DisplayName("Database refuses negative line amounts")
    void databaseRejectsNegativeLine() {
        JournalEntry entry = ledgerService.postEntry(JournalEntryRequest.simple(
            "Valid", null, null, cashId, revenueId, new BigDecimal("10.00")));

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "INSERT INTO journal_lines (entry_id, account_id, debit, credit) VALUES (?, ?, ?, ?)",
            entry.getId(), cashId, new BigDecimal("-1.00"), BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Database refuses a line with both sides or neither")
    void databaseRejectsTwoSidedLine() {
        JournalEntry entry = ledgerService.postEntry(JournalEntryRequest.simple(
            "Valid", null, null, cashId, revenueId, new BigDecimal("10.00")));

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "INSERT INTO journal_lines (entry_id, account_id, debit, credit) VALUES (?, ?, ?, ?)",
            entry.getId(), cashId, new BigDecimal("5.00"), new BigDecimal("5.00")));
        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
            "INSERT INTO journal_lines (entry_id, account_id, debit, credit) VALUES (?, ?, ?, ?)",
            entry.getId(), cashId, BigDecimal.ZERO, BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Replacing lines keeps the entry id and posting date")
    void replaceLinesKeepsEntry() {
        // Given
        JournalEntry original = ledgerService.postEntry(JournalEntryRequest.simple(
            "Supplies", null, null, suppliesId, cashId, new BigDecimal("40.00"))
            .postedOn(LocalDate.of(2024, 1, 10)));

        // When
        Long equityId = chartOfAccounts.ownerEquity().getId();
        JournalEntry replaced = ledgerService.replaceLines(original.getId(), JournalEntryRequest.simple(
            null, null, null, equityId, cashId, new BigDecimal("40.00")));

        // Then
        assertEquals(original.getId(), replaced.getId());
        assertEquals(original.getPostedAt(), replaced.getPostedAt());
        assertEquals("Supplies", replaced.getDescription());
        assertEquals(2, replaced.getLines().size());
        assertEquals(0, replaced.debitsTo(equityId).compareTo(new BigDecimal("40.00")));
        assertEquals(0, replaced.debitsTo(suppliesId).signum());
        assertEquals(0, ledgerService.getAccountBalance(suppliesId).signum());
    }

    @Test
    @DisplayName("Deleting an entry removes its lines")
    void deleteEntryCascadesToLines() {
        JournalEntry entry = ledgerService.postEntry(JournalEntryRequest.simple(
            "Temp", null, null, cashId, revenueId, new BigDecimal("5.00")));

        ledgerService.deleteEntry(entry.getId());

        assertTrue(ledgerService.findEntry(entry.getId()).isEmpty());
        assertEquals(0, countRows("journal_lines"));
        assertEquals(0, ledgerService.getAccountBalance(cashId).signum());
    }

    @Test
    @DisplayName("Posting and deleting write ledger events to the outbox")
    void writesOutboxEvents() {
        JournalEntry entry = ledgerService.postEntry(JournalEntryRequest.simple(
            "Evented", null, null, cashId, revenueId, new BigDecimal("5.00")));
        ledgerService.deleteEntry(entry.getId());

        assertEquals(1, outboxEventRepository.findByEventTypeOrderByCreatedAtAsc(JournalEntryPostedEvent.EVENT_TYPE).size());
        assertEquals(1, outboxEventRepository.findByEventTypeOrderByCreatedAtAsc(JournalEntryRemovedEvent.EVENT_TYPE).size());
    }

    private int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count != null ? count : 0;
    }
}
