package com.ardua.ledger.api.dto;

import com.ardua.ledger.importing.ImportResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class ImportResultResponse {

    @JsonProperty("imported")
    int imported;

    @JsonProperty("skipped")
    int skipped;

    @JsonProperty("transaction_ids")
    List<Long> transactionIds;

    public static ImportResultResponse from(ImportResult result) {
        return new ImportResultResponse(result.getImported(), result.getSkipped(), result.getTransactionIds());
    }
}
