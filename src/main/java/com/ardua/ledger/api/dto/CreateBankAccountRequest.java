package com.ardua.ledger.api.dto;

import com.ardua.ledger.banking.BankAccountType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateBankAccountRequest {

    @NotNull(message = "Account type is required")
    @JsonProperty("type")
    BankAccountType type;

    @NotBlank(message = "Institution is required")
    @Size(max = 255, message = "Institution must be at most 255 characters")
    @JsonProperty("institution")
    String institution;

    @NotBlank(message = "Masked number is required")
    @Size(max = 20, message = "Masked number must be at most 20 characters")
    @JsonProperty("masked_number")
    String maskedNumber;

    /** Optional, zero when absent. */
    @JsonProperty("opening_balance")
    BigDecimal openingBalance;
}
