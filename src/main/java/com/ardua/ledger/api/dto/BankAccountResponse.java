package com.ardua.ledger.api.dto;

import com.ardua.ledger.banking.BankAccount;
import com.ardua.ledger.banking.BankAccountType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BankAccountResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("type")
    BankAccountType type;

    @JsonProperty("name")
    String name;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BankAccountResponse from(BankAccount account, BigDecimal balance) {
        return BankAccountResponse.builder()
            .id(account.getId())
            .accountId(account.getAccountId())
            .type(account.getType())
            .name(account.displayName())
            .openingBalance(account.getOpeningBalance())
            .balance(balance)
            .createdAt(account.getCreatedAt())
            .build();
    }
}
