package com.ardua.ledger.api.dto;

import com.ardua.ledger.payment.Payment;
import com.ardua.ledger.payment.PaymentMethod;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("memo")
    String memo;

    @JsonProperty("unapplied_amount")
    BigDecimal unappliedAmount;

    @JsonProperty("posted")
    boolean posted;

    public static PaymentResponse from(Payment payment, boolean posted) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .clientId(payment.getClientId())
            .date(payment.getPaymentDate())
            .amount(payment.getAmount())
            .method(payment.getMethod())
            .memo(payment.getMemo())
            .unappliedAmount(payment.getUnappliedAmount())
            .posted(posted)
            .build();
    }
}
