package com.ardua.ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for the posting engine.
 *
 * <ul>
 *   <li>{@code ledger.entries.posted} tagged by source type</li>
 *   <li>{@code ledger.entries.removed} tagged by source type</li>
 *   <li>{@code ledger.matches} tagged by kind (payment, expense, transfer, unmatched)</li>
 *   <li>{@code ledger.import.rows} tagged by outcome (imported, skipped)</li>
 *   <li>{@code ledger.operation.duration} tagged by operation</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEntryPosted(String sourceType) {
        registry.counter("ledger.entries.posted", "source_type", sourceType).increment();
    }

    public void recordEntryRemoved(String sourceType) {
        registry.counter("ledger.entries.removed", "source_type", sourceType).increment();
    }

    public void recordMatch(String kind) {
        registry.counter("ledger.matches", "kind", kind).increment();
    }

    public void recordImportedRows(int imported, int skipped) {
        registry.counter("ledger.import.rows", "outcome", "imported").increment(imported);
        registry.counter("ledger.import.rows", "outcome", "skipped").increment(skipped);
    }

    public void recordOperation(String operation, Duration duration) {
        registry.timer("ledger.operation.duration", "operation", operation).record(duration);
    }
}
