package com.ardua.ledger.api;

import com.ardua.ledger.api.dto.AllocationRequest;
import com.ardua.ledger.api.dto.JournalEntryResponse;
import com.ardua.ledger.api.dto.PaymentResponse;
import com.ardua.ledger.api.dto.RecordPaymentRequest;
import com.ardua.ledger.payment.Payment;
import com.ardua.ledger.payment.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentService paymentService;

    /**
     * Records, allocates and posts a client payment in one step.
     */
    @PostMapping
    public ResponseEntity<PaymentResponse> recordPayment(
            @Valid @RequestBody RecordPaymentRequest request,
            @RequestHeader(value = InvoiceController.USER_HEADER, required = false) String user) {
        log.info("Received payment: client={}, amount={}, method={}",
            request.getClientId(), request.getAmount(), request.getMethod());
        Payment payment = paymentService.recordPayment(request.getClientId(), request.getDate(),
            request.getAmount(), request.getMethod(), request.getMemo(),
            AllocationRequest.toAllocations(request.getAllocations()), user);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment, true));
    }

    @GetMapping("/{id}")
    public PaymentResponse getPayment(@PathVariable("id") Long id) {
        return PaymentResponse.from(paymentService.getPayment(id), paymentService.isPosted(id));
    }

    @PostMapping("/{id}/post")
    public JournalEntryResponse post(@PathVariable("id") Long id,
                                     @RequestHeader(value = InvoiceController.USER_HEADER, required = false) String user) {
        return JournalEntryResponse.from(paymentService.postToAccounting(id, user));
    }
}
