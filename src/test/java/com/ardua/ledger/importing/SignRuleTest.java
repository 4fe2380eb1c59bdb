package com.ardua.ledger.importing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class SignRuleTest {

    @Test
    @DisplayName("Bank exports keep their sign")
    void bankStandardPassesThrough() {
        assertEquals(new BigDecimal("45.00"), SignRule.BANK_STANDARD.normalize(new BigDecimal("45.00")));
        assertEquals(new BigDecimal("-45.00"), SignRule.BANK_STANDARD.normalize(new BigDecimal("-45.00")));
    }

    @Test
    @DisplayName("Positive card charges become withdrawals")
    void positiveChargesAreNegated() {
        assertEquals(new BigDecimal("-45.00"), SignRule.CC_CHARGES_POSITIVE.normalize(new BigDecimal("45.00")));
        assertEquals(new BigDecimal("20.00"), SignRule.CC_CHARGES_POSITIVE.normalize(new BigDecimal("-20.00")));
    }

    @Test
    @DisplayName("Negative card charges are already in internal form")
    void negativeChargesPassThrough() {
        assertEquals(new BigDecimal("-45.00"), SignRule.CC_CHARGES_NEGATIVE.normalize(new BigDecimal("-45.00")));
    }
}
