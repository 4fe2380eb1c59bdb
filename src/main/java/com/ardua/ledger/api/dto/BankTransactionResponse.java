package com.ardua.ledger.api.dto;

import com.ardua.ledger.banking.BankTransaction;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class BankTransactionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("bank_account_id")
    Long bankAccountId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("offset_account_id")
    Long offsetAccountId;

    @JsonProperty("journal_entry_id")
    Long journalEntryId;

    @JsonProperty("payment_id")
    Long paymentId;

    @JsonProperty("expense_id")
    Long expenseId;

    @JsonProperty("transfer_pair_id")
    Long transferPairId;

    @JsonProperty("matched")
    boolean matched;

    public static BankTransactionResponse from(BankTransaction txn) {
        return BankTransactionResponse.builder()
            .id(txn.getId())
            .bankAccountId(txn.getBankAccountId())
            .date(txn.getDate())
            .description(txn.getDescription())
            .amount(txn.getAmount())
            .offsetAccountId(txn.getOffsetAccountId())
            .journalEntryId(txn.getJournalEntryId())
            .paymentId(txn.getPaymentId())
            .expenseId(txn.getExpenseId())
            .transferPairId(txn.getTransferPairId())
            .matched(txn.isMatched())
            .build();
    }
}
