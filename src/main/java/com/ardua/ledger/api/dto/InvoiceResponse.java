package com.ardua.ledger.api.dto;

import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoicePostingState;
import com.ardua.ledger.billing.InvoiceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("issue_date")
    LocalDate issueDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("posting_state")
    InvoicePostingState postingState;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("outstanding_balance")
    BigDecimal outstandingBalance;

    public static InvoiceResponse from(Invoice invoice, BigDecimal outstanding) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .clientId(invoice.getClientId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .issueDate(invoice.getIssueDate())
            .dueDate(invoice.getDueDate())
            .status(invoice.getStatus())
            .postingState(invoice.getPostingState())
            .total(invoice.getTotal())
            .outstandingBalance(outstanding)
            .build();
    }
}
