package com.ardua.ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class BatchLinkRequest {

    @NotEmpty(message = "At least one link is required")
    @Valid
    @JsonProperty("links")
    List<Link> links;

    public Map<Long, Long> toMap() {
        Map<Long, Long> map = new LinkedHashMap<>();
        links.forEach(link -> map.put(link.getBankTransactionId(), link.getTargetId()));
        return map;
    }

    @Value
    public static class Link {
        @NotNull(message = "Bank transaction id is required")
        @JsonProperty("bank_transaction_id")
        Long bankTransactionId;

        @NotNull(message = "Target id is required")
        @JsonProperty("target_id")
        Long targetId;
    }
}
