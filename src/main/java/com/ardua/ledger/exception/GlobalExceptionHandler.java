package com.ardua.ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine errors onto HTTP responses.
 *
 * Conflicts with the current state of a document (already matched, wrong
 * status, referenced account) are 409; input the engine cannot act on
 * (mismatched amounts, missing GL account, bad configuration, bad statement
 * row) is 422. Unbalanced entries are programming errors and surface as 500.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({
        AlreadyMatchedException.class,
        SameAccountTransferException.class,
        InvalidStateTransitionException.class,
        AccountInUseException.class
    })
    public ResponseEntity<ApiError> handleConflict(LedgerDomainException e) {
        log.warn("Rejected operation: code={}, message={}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(domainError("Conflict", e, null));
    }

    @ExceptionHandler({
        AmountMismatchException.class,
        MissingGlAccountException.class,
        InvalidConfigurationException.class
    })
    public ResponseEntity<ApiError> handleUnprocessable(LedgerDomainException e) {
        log.warn("Unprocessable request: code={}, message={}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(domainError("Unprocessable Entity", e, null));
    }

    @ExceptionHandler(StatementImportException.class)
    public ResponseEntity<ApiError> handleImportFailure(StatementImportException e) {
        log.warn("Statement import aborted at row {}: {}", e.getRowNumber(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(domainError("Import Failed", e, Map.of("row", String.valueOf(e.getRowNumber()))));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.builder()
            .error("Not Found")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiError> handleMissingInput(Exception e) {
        log.warn("Missing request input: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(UnbalancedEntryException.class)
    public ResponseEntity<ApiError> handleUnbalanced(UnbalancedEntryException e) {
        log.error("Ledger invariant violated", e);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return internalError();
    }

    private ApiError domainError(String error, LedgerDomainException e, Map<String, String> details) {
        return ApiError.builder()
            .error(error)
            .code(e.getErrorCode().name())
            .message(e.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();
    }

    private ResponseEntity<ApiError> internalError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build());
    }
}
