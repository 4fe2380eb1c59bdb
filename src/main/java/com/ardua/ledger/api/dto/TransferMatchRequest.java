package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class TransferMatchRequest {

    @NotNull(message = "First transaction id is required")
    @JsonProperty("first_transaction_id")
    Long firstTransactionId;

    @NotNull(message = "Second transaction id is required")
    @JsonProperty("second_transaction_id")
    Long secondTransactionId;
}
