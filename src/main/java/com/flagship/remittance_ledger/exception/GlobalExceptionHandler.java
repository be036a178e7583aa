package com.flagship.remittance_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine exceptions and Spring MVC binding failures to {@link ApiError} responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RemittanceLedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(RemittanceLedgerException e) {
        ErrorCode code = e.getErrorCode();
        if (code == ErrorCode.CONFLICT) {
            log.warn("Rejected after retries: {}", e.getMessage());
        } else {
            log.warn("Rejected request [{}]: {}", code, e.getMessage());
        }
        return respond(code, titleFor(code), e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(ErrorCode.VALIDATION_ERROR, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(ErrorCode.VALIDATION_ERROR, "Missing Required Parameter",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
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

        return respond(ErrorCode.VALIDATION_ERROR, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, "Invalid Request", "Malformed request parameter or body", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Integrity violation: {}", e.getMostSpecificCause().getMessage());
        return respond(ErrorCode.CONFLICT, "Conflict", "Request conflicts with existing data", null);
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ApiError> handleConcurrencyFailure(ConcurrencyFailureException e) {
        log.warn("Lock conflict: {}", e.getMessage());
        return respond(ErrorCode.CONFLICT, "Conflict", "The record is being modified concurrently, retry the request", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(ErrorCode.INTERNAL, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> respond(ErrorCode code, String title, String message,
                                                    Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(title)
            .code(code)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(code.httpStatus()).body(body);
    }

    private static String titleFor(ErrorCode code) {
        return switch (code) {
            case NOT_FOUND -> "Not Found";
            case INVALID_STATE -> "Invalid State";
            case INSUFFICIENT_FUNDS -> "Insufficient Funds";
            case VALIDATION_ERROR -> "Invalid Request";
            case CONFLICT -> "Conflict";
            case INTERNAL -> "Internal Server Error";
        };
    }
}
