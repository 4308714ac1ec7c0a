package com.flagship.btc_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine failures to HTTP responses.
 *
 * Validation problems are 400, edits of locked transactions 409, a history
 * that would need BTC it does not have 422. A replay that breaks an internal
 * rule is a 500: the request was rolled back and nothing was committed.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request",
            "Request body is missing or is not a valid transaction", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Bad parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
            "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TransactionNotFoundException e) {
        log.warn(e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientBitcoinException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBitcoin(InsufficientBitcoinException e) {
        log.warn("Rejected change: {}", e.getMessage());

        Map<String, String> details = replayDetails(e);
        details.put("required", e.getRequired().toPlainString());
        details.put("available", e.getAvailable().toPlainString());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Bitcoin", e.getMessage(), details);
    }

    @ExceptionHandler(LedgerConsistencyException.class)
    public ResponseEntity<ErrorResponse> handleLedgerConsistency(LedgerConsistencyException e) {
        log.error("Ledger replay broke an internal rule", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Ledger Inconsistency", e.getMessage(), replayDetails(e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private static Map<String, String> replayDetails(LedgerReplayException e) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("transactionId", String.valueOf(e.getTransactionId()));
        details.put("stage", String.valueOf(e.getStage()));
        return details;
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
