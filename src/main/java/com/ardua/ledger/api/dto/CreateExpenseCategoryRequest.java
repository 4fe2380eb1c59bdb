package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CreateExpenseCategoryRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("billable_by_default")
    boolean billableByDefault;
}
