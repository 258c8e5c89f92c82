package com.flagship.deposit_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps ledger rejections and request errors to HTTP responses.
 *
 * A {@link LedgerException} keeps its error code as the {@code error} field so
 * clients can branch on it; everything else gets a generic label.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Ledger operation failed: code={}, message={}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("Ledger operation rejected: code={}, message={}", e.getErrorCode(), e.getMessage());
        }
        return respond(status, e.getErrorCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fields = new TreeMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(),
                    error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value");
        }
        log.warn("Validation failed: {}", fields);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Request body is missing or malformed; amounts must be JSON integers", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    static HttpStatus statusFor(LedgerErrorCode code) {
        return switch (code) {
            case MARKET_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case MARKET_ALREADY_EXISTS, REENTRANT_CALL -> HttpStatus.CONFLICT;
            case INVALID_AMOUNT, INVALID_INTEREST_RATE -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_BALANCE, INSUFFICIENT_SHARES -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case CUSTODY_TRANSFER_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build());
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
