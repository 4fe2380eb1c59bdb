package com.ardua.ledger.api.dto;

import com.ardua.ledger.payment.PaymentMethod;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

@Value
public class PaymentFromTransactionRequest {

    @NotNull(message = "Client id is required")
    @JsonProperty("client_id")
    Long clientId;

    @NotNull(message = "Method is required")
    @JsonProperty("method")
    PaymentMethod method;

    @Size(max = 255, message = "Memo must be at most 255 characters")
    @JsonProperty("memo")
    String memo;

    @Valid
    @JsonProperty("allocations")
    List<AllocationRequest> allocations;
}
