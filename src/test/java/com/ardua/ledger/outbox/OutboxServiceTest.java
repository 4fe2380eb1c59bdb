package com.ardua.ledger.outbox;

import com.ardua.ledger.event.JournalEntryPostedEvent;
import com.ardua.ledger.ledger.ChartOfAccountsService;
import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.ledger.JournalEntryRequest;
import com.ardua.ledger.ledger.LedgerService;
import com.ardua.ledger.ledger.SourceReference;
import com.ardua.ledger.ledger.SourceType;
import com.ardua.ledger.support.DatabaseCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class OutboxServiceTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbcTemplate);
    }

    @Test
    @DisplayName("Posting writes an unpublished event keyed by the source document")
    void postingWritesEvent() {
        // When
        ledgerService.postEntry(JournalEntryRequest.simple("Invoice 00042 issued", null,
            SourceReference.of(SourceType.INVOICE, 42L),
            chartOfAccounts.accountsReceivable().getId(), chartOfAccounts.revenue().getId(),
            new BigDecimal("100.00")));

        // Then
        List<OutboxEvent> events = outboxService.getEventsForAggregate("INVOICE", 42L);
        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertEquals(JournalEntryPostedEvent.EVENT_TYPE, event.getEventType());
        assertEquals("INVOICE:42", event.partitionKey());
        assertFalse(event.isPublished());
        assertTrue(event.getPayload().contains("Invoice 00042 issued"));
        assertEquals(1, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Saving an event outside a transaction is refused")
    void requiresTransaction() {
        JournalEntry entry = new JournalEntry(1L, null, null, "Orphan", null, List.of());

        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent(JournalEntryPostedEvent.posted(entry, Instant.now())));
    }

    @Test
    @DisplayName("Failures bump the retry count; publishing clears the backlog")
    void marksFailedThenPublished() {
        // Given
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        JournalEntry entry = new JournalEntry(7L, null, null, "Manual", null, List.of());
        OutboxEvent saved = transaction.execute(status ->
            outboxService.saveEvent(JournalEntryPostedEvent.posted(entry, Instant.now())));
        assertNotNull(saved);
        assertEquals("JOURNAL_ENTRY:7", saved.partitionKey());

        // When
        outboxService.markFailed(saved.getId(), "broker unavailable");
        outboxService.markFailed(saved.getId(), "broker unavailable");

        // Then
        OutboxEvent failed = outboxService.getEventsForAggregate("JOURNAL_ENTRY", 7L).get(0);
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());

        outboxService.markPublished(saved.getId());
        assertTrue(outboxService.getEventsForAggregate("JOURNAL_ENTRY", 7L).get(0).isPublished());
        assertEquals(0, outboxService.countUnpublished());
    }
}
