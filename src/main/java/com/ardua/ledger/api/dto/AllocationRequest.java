package com.ardua.ledger.api.dto;

import com.ardua.ledger.payment.PaymentAllocation;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class AllocationRequest {

    @NotNull(message = "Invoice id is required")
    @JsonProperty("invoice_id")
    Long invoiceId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    public static List<PaymentAllocation> toAllocations(List<AllocationRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream()
            .map(request -> new PaymentAllocation(request.getInvoiceId(), request.getAmount()))
            .toList();
    }
}
