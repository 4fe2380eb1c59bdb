package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class CreateInvoiceRequest {

    @NotNull(message = "Client id is required")
    @JsonProperty("client_id")
    Long clientId;

    @NotNull(message = "Issue date is required")
    @JsonProperty("issue_date")
    LocalDate issueDate;

    /** Generated when absent. */
    @JsonProperty("invoice_number")
    String invoiceNumber;
}
