package com.ardua.ledger.api.dto;

import com.ardua.ledger.payment.PaymentMethod;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class RecordPaymentRequest {

    @NotNull(message = "Client id is required")
    @JsonProperty("client_id")
    Long clientId;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

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
