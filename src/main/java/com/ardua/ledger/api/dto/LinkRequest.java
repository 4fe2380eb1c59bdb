package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class LinkRequest {

    @NotNull(message = "Target id is required")
    @JsonProperty("target_id")
    Long targetId;
}
