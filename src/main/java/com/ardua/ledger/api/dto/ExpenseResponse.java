package com.ardua.ledger.api.dto;

import com.ardua.ledger.billing.Expense;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("category_id")
    Long categoryId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("billable")
    boolean billable;

    @JsonProperty("payment_account_id")
    Long paymentAccountId;

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .clientId(expense.getClientId())
            .categoryId(expense.getCategoryId())
            .date(expense.getExpenseDate())
            .amount(expense.getAmount())
            .description(expense.getDescription())
            .billable(expense.isBillable())
            .paymentAccountId(expense.getPaymentAccountId())
            .build();
    }
}
