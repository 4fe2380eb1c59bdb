package com.ardua.ledger.importing;

import lombok.Value;

import java.util.List;

@Value
public class ImportResult {
    List<Long> transactionIds;
    int skipped;

    public int getImported() {
        return transactionIds.size();
    }
}
