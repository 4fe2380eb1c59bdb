package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class PostTransactionRequest {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;

    /** Positive for money in, negative for money out. */
    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Offset account is required")
    @JsonProperty("offset_account_id")
    Long offsetAccountId;
}
