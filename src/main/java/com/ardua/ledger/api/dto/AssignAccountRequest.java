package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class AssignAccountRequest {

    @NotNull(message = "Account is required")
    @JsonProperty("account_id")
    Long accountId;
}
