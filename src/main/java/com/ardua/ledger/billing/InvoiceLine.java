package com.ardua.ledger.billing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Entity
@Table(name = "invoice_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private Long invoiceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "line_type", nullable = false, length = 20)
    private InvoiceLineType lineType;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(nullable = false, precision = 8, scale = 2)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "line_total", nullable = false, precision = 10, scale = 2)
    private BigDecimal lineTotal;

    static InvoiceLine of(Long invoiceId, InvoiceLineType type, String description,
                          BigDecimal quantity, BigDecimal unitPrice) {
        InvoiceLine line = new InvoiceLine();
        line.invoiceId = invoiceId;
        line.lineType = type;
        line.description = description;
        line.quantity = quantity;
        line.unitPrice = unitPrice;
        line.lineTotal = quantity.multiply(unitPrice).setScale(2, RoundingMode.HALF_UP);
        return line;
    }
}
