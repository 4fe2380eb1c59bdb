package com.ardua.ledger.api;

import com.ardua.ledger.api.dto.CreateInvoiceRequest;
import com.ardua.ledger.api.dto.InvoiceLineRequest;
import com.ardua.ledger.api.dto.InvoiceResponse;
import com.ardua.ledger.api.dto.LinkRequest;
import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoiceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Invoice lifecycle. The optional {@code X-User} header is recorded on the
 * journal entries an action posts.
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    static final String USER_HEADER = "X-User";

    private final InvoiceService invoiceService;

    @PostMapping
    public ResponseEntity<InvoiceResponse> createDraft(@Valid @RequestBody CreateInvoiceRequest request) {
        Invoice invoice = invoiceService.createDraft(
            request.getClientId(), request.getIssueDate(), request.getInvoiceNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(invoice));
    }

    @GetMapping("/{id}")
    public InvoiceResponse getInvoice(@PathVariable("id") Long id) {
        return toResponse(invoiceService.getInvoice(id));
    }

    @PostMapping("/{id}/lines")
    public InvoiceResponse addLine(@PathVariable("id") Long id, @Valid @RequestBody InvoiceLineRequest request) {
        invoiceService.addLine(id, request.getType(), request.getDescription(),
            request.getQuantity(), request.getUnitPrice());
        return toResponse(invoiceService.getInvoice(id));
    }

    @PostMapping("/{id}/expenses")
    public InvoiceResponse billExpense(@PathVariable("id") Long id, @Valid @RequestBody LinkRequest request) {
        invoiceService.billExpense(id, request.getTargetId());
        return toResponse(invoiceService.getInvoice(id));
    }

    @PostMapping("/{id}/issue")
    public InvoiceResponse issue(@PathVariable("id") Long id,
                                 @RequestHeader(value = USER_HEADER, required = false) String user) {
        return toResponse(invoiceService.issue(id, user));
    }

    @PostMapping("/{id}/return-to-draft")
    public InvoiceResponse returnToDraft(@PathVariable("id") Long id,
                                         @RequestHeader(value = USER_HEADER, required = false) String user) {
        return toResponse(invoiceService.returnToDraft(id, user));
    }

    @PostMapping("/{id}/void")
    public InvoiceResponse voidInvoice(@PathVariable("id") Long id,
                                       @RequestHeader(value = USER_HEADER, required = false) String user) {
        return toResponse(invoiceService.voidInvoice(id, user));
    }

    @PostMapping("/{id}/mark-paid")
    public InvoiceResponse markPaid(@PathVariable("id") Long id) {
        return toResponse(invoiceService.markPaid(id));
    }

    private InvoiceResponse toResponse(Invoice invoice) {
        return InvoiceResponse.from(invoice, invoiceService.outstandingBalance(invoice.getId()));
    }
}
