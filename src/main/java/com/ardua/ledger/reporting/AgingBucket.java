package com.ardua.ledger.reporting;

/**
 * Days past due, inclusive upper bounds. Invoices not yet due fall in the first bucket.
 */
public enum AgingBucket {
    CURRENT_TO_30,
    DAYS_31_TO_60,
    DAYS_61_TO_90,
    OVER_90;

    public static AgingBucket forDaysPastDue(long days) {
        if (days <= 30) {
            return CURRENT_TO_30;
        }
        if (days <= 60) {
            return DAYS_31_TO_60;
        }
        if (days <= 90) {
            return DAYS_61_TO_90;
        }
        return OVER_90;
    }
}
