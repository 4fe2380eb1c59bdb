package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class CreateExpenseRequest {

    @JsonProperty("client_id")
    Long clientId;

    @NotNull(message = "Category id is required")
    @JsonProperty("category_id")
    Long categoryId;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("billable")
    boolean billable;
}
