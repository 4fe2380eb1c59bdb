package com.ardua.ledger.importing;

import java.math.BigDecimal;

/**
 * How a statement file signs its amounts. Internally a positive amount is
 * money in and a negative amount money out.
 */
public enum SignRule {
    /** Bank export: + deposit, - withdrawal. Already internal. */
    BANK_STANDARD,
    /** Card export showing charges as positive and payments as negative. */
    CC_CHARGES_POSITIVE,
    /** Card export showing charges as negative and payments as positive. */
    CC_CHARGES_NEGATIVE;

    public BigDecimal normalize(BigDecimal raw) {
        return switch (this) {
            case BANK_STANDARD, CC_CHARGES_NEGATIVE -> raw;
            case CC_CHARGES_POSITIVE -> raw.negate();
        };
    }
}
