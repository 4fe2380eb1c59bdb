package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Body naming a single GL account, used for retag and unmatch.
 */
@Value
public class AccountRequest {

    @NotNull(message = "Account id is required")
    @JsonProperty("account_id")
    Long accountId;
}
