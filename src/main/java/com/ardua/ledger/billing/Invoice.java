package com.ardua.ledger.billing;

import com.ardua.ledger.exception.InvalidStateTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Client invoice. {@code total} is a cached aggregate of the lines and is only
 * changed through {@link #updateTotals(BigDecimal)}. Status changes go through
 * the transition methods, which reject moves the state machine does not allow.
 */
@Entity
@Table(name = "invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id", nullable = false, updatable = false)
    private Long clientId;

    @Column(name = "invoice_number", nullable = false, unique = true, length = 50)
    private String invoiceNumber;

    @Column(name = "issue_date", nullable = false)
    private LocalDate issueDate;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private InvoiceStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "posting_state", nullable = false, length = 10)
    private InvoicePostingState postingState;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal taxAmount;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal total;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static Invoice draft(Long clientId, String invoiceNumber, LocalDate issueDate, LocalDate dueDate) {
        Invoice invoice = new Invoice();
        invoice.clientId = clientId;
        invoice.invoiceNumber = invoiceNumber;
        invoice.issueDate = issueDate;
        invoice.dueDate = dueDate;
        invoice.status = InvoiceStatus.DRAFT;
        invoice.postingState = InvoicePostingState.UNPOSTED;
        invoice.subtotal = BigDecimal.ZERO;
        invoice.taxAmount = BigDecimal.ZERO;
        invoice.total = BigDecimal.ZERO;
        return invoice;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Tax is a flat pass-through and currently always zero.
     */
    void updateTotals(BigDecimal linesTotal) {
        requireStatus(InvoiceStatus.DRAFT, "change lines of");
        this.subtotal = linesTotal;
        this.taxAmount = BigDecimal.ZERO;
        this.total = linesTotal;
    }

    void issue() {
        requireStatus(InvoiceStatus.DRAFT, "issue");
        this.status = InvoiceStatus.ISSUED;
    }

    void returnToDraft() {
        requireStatus(InvoiceStatus.ISSUED, "return to draft");
        this.status = InvoiceStatus.DRAFT;
    }

    void markVoid() {
        if (status != InvoiceStatus.DRAFT && status != InvoiceStatus.ISSUED) {
            throw new InvalidStateTransitionException(
                "Invoice " + invoiceNumber + " cannot be voided from " + status);
        }
        this.status = InvoiceStatus.VOID;
    }

    void markPaid() {
        requireStatus(InvoiceStatus.ISSUED, "mark paid");
        this.status = InvoiceStatus.PAID;
    }

    public void markPosted() {
        this.postingState = InvoicePostingState.POSTED;
    }

    public void markReversed() {
        this.postingState = InvoicePostingState.REVERSED;
    }

    public boolean isOpen() {
        return status == InvoiceStatus.ISSUED;
    }

    private void requireStatus(InvoiceStatus expected, String action) {
        if (status != expected) {
            throw new InvalidStateTransitionException(
                "Cannot " + action + " invoice " + invoiceNumber + " in " + status + " status");
        }
    }
}
