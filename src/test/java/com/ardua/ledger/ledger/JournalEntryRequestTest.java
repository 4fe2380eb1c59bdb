package com.ardua.ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JournalEntryRequestTest {

    @Test
    @DisplayName("Simple request has one debit and one credit of the same amount")
    void simpleRequestIsBalanced() {
        JournalEntryRequest request = JournalEntryRequest.simple(
            "Test", "alice", null, 1L, 2L, new BigDecimal("25.00"));

        assertTrue(request.isBalanced());
        assertEquals(1, request.getDebits().size());
        assertEquals(1, request.getCredits().size());
        assertEquals(0, request.getDebitTotal().compareTo(new BigDecimal("25.00")));
        assertNull(request.getPostedAt(), "No posting date means now");
    }

    @Test
    @DisplayName("Split credits are summed before comparing with the debit side")
    void splitCreditsBalance() {
        JournalEntryRequest request = new JournalEntryRequest("Split", null, null,
            List.of(JournalEntryRequest.DebitCredit.of(1L, new BigDecimal("100.00"))),
            List.of(JournalEntryRequest.DebitCredit.of(2L, new BigDecimal("60.00")),
                JournalEntryRequest.DebitCredit.of(3L, new BigDecimal("40.00"))));

        assertTrue(request.isBalanced());

        JournalEntryRequest uneven = new JournalEntryRequest("Uneven", null, null,
            List.of(JournalEntryRequest.DebitCredit.of(1L, new BigDecimal("100.00"))),
            List.of(JournalEntryRequest.DebitCredit.of(2L, new BigDecimal("99.99"))));

        assertFalse(uneven.isBalanced());
    }

    @Test
    @DisplayName("Line amounts must be positive")
    void rejectsNonPositiveLines() {
        assertThrows(IllegalArgumentException.class,
            () -> JournalEntryRequest.DebitCredit.of(1L, BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> JournalEntryRequest.DebitCredit.of(1L, new BigDecimal("-5.00")));
    }

    @Test
    @DisplayName("postedOn keeps the lines and dates the entry at the start of the day")
    void postedOnDatesEntry() {
        JournalEntryRequest request = JournalEntryRequest.simple(
            "Dated", null, null, 1L, 2L, new BigDecimal("10.00"));

        JournalEntryRequest dated = request.postedOn(LocalDate.of(2024, 3, 15));

        assertEquals(LocalDate.of(2024, 3, 15).atStartOfDay(), dated.getPostedAt());
        assertEquals(request.getDebits(), dated.getDebits());
        assertEquals(request.getCredits(), dated.getCredits());
    }
}
