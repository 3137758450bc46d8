package com.openforge.kairn.error;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Centralized exception handler: every failure leaves the API as an
 * {@link ApiError} so callers can show it to the end user unchanged.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(KairnException.class)
    public ResponseEntity<ApiError> handleKairn(KairnException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (ex.getKind() == ErrorKind.STORE_FAILURE) {
            log.error("[API] {}: {}", ex.getKind().code(), ex.getMessage(), ex);
        } else {
            log.warn("[API] {}: {}", ex.getKind().code(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiError(ex.getKind(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return invalidArgument(message.isEmpty() ? "Invalid request body" : message);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return invalidArgument(ex.getMessage());
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class, BulkheadFullException.class})
    public ResponseEntity<ApiError> handleStore(RuntimeException ex) {
        log.error("[API] Store failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError(ErrorKind.STORE_FAILURE, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError(ErrorKind.STORE_FAILURE, "Internal server error"));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case STORE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private ResponseEntity<ApiError> invalidArgument(String message) {
        log.warn("[API] Bad request: {}", message);
        return ResponseEntity.badRequest().body(new ApiError(ErrorKind.INVALID_ARGUMENT, message));
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
