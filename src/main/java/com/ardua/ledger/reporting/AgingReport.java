package com.ardua.ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
public class AgingReport {
    LocalDate asOf;
    Map<AgingBucket, List<AgingLine>> buckets;

    public BigDecimal totalFor(AgingBucket bucket) {
        return buckets.getOrDefault(bucket, List.of()).stream()
            .map(AgingLine::getOutstanding)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalOutstanding() {
        return buckets.values().stream()
            .flatMap(List::stream)
            .map(AgingLine::getOutstanding)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
