package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CreateClientRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    /** Defaults to 30 when absent. */
    @Min(value = 0, message = "Payment terms cannot be negative")
    @JsonProperty("payment_terms_days")
    Integer paymentTermsDays;
}
