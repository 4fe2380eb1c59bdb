package com.ardua.ledger.banking;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a batch link run. Each row is linked, skipped because the
 * transaction was already matched, or failed with a message.
 */
@Value
public class BatchMatchResult {
    List<Long> linked;
    List<Long> skipped;
    List<RowError> errors;

    public int getLinkedCount() {
        return linked.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Value
    public static class RowError {
        Long bankTransactionId;
        String message;
    }
}
