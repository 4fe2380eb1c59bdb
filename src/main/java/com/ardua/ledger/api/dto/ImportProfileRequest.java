package com.ardua.ledger.api.dto;

import com.ardua.ledger.importing.SignRule;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ImportProfileRequest {

    @NotNull(message = "Date column is required")
    @Min(value = 0, message = "Column indices start at 0")
    @JsonProperty("date_column")
    Integer dateColumn;

    @NotNull(message = "Description column is required")
    @Min(value = 0, message = "Column indices start at 0")
    @JsonProperty("description_column")
    Integer descriptionColumn;

    @NotNull(message = "Amount column is required")
    @Min(value = 0, message = "Column indices start at 0")
    @JsonProperty("amount_column")
    Integer amountColumn;

    @JsonProperty("date_format")
    String dateFormat;

    /** Optional for checking and savings accounts. */
    @JsonProperty("sign_rule")
    SignRule signRule;

    @JsonProperty("skip_if_description_contains")
    String skipIfDescriptionContains;
}
