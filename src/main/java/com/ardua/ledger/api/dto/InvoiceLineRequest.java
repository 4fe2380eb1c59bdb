package com.ardua.ledger.api.dto;

import com.ardua.ledger.billing.InvoiceLineType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class InvoiceLineRequest {

    @NotNull(message = "Line type is required")
    @JsonProperty("type")
    InvoiceLineType type;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Quantity is required")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @NotNull(message = "Unit price is required")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;
}
