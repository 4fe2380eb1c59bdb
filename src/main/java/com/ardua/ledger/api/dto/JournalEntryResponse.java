package com.ardua.ledger.api.dto;

import com.ardua.ledger.ledger.JournalEntry;
import com.ardua.ledger.ledger.JournalLine;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("posted_at")
    LocalDateTime postedAt;

    @JsonProperty("posted_by")
    String postedBy;

    @JsonProperty("description")
    String description;

    @JsonProperty("source_type")
    String sourceType;

    @JsonProperty("source_id")
    Long sourceId;

    @JsonProperty("lines")
    List<Line> lines;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .postedAt(entry.getPostedAt())
            .postedBy(entry.getPostedBy())
            .description(entry.getDescription())
            .sourceType(entry.getSource() != null ? entry.getSource().getType().name() : null)
            .sourceId(entry.getSource() != null ? entry.getSource().getId() : null)
            .lines(entry.getLines().stream().map(Line::from).toList())
            .build();
    }

    @Value
    public static class Line {
        @JsonProperty("account_id")
        Long accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        static Line from(JournalLine line) {
            return new Line(line.getAccountId(), line.getDebit(), line.getCredit());
        }
    }
}
