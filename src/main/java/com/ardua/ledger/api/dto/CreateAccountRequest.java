package com.ardua.ledger.api.dto;

import com.ardua.ledger.ledger.AccountType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Code is required")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 300, message = "Name must be at most 300 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("type")
    AccountType type;
}
