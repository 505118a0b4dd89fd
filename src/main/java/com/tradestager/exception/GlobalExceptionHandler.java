package com.tradestager.exception;

import com.tradestager.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Turns exceptions into the {@link ApiErrorResponse} envelope. Staging failures keep their
 * reasons and retryable flag; request validation failures list each offending field both in
 * {@code details} and as {@code reasons}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ==== Request validation ====

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new TreeMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            details.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return validationFailure(details, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, Object> details = new TreeMap<>();
        ex.getConstraintViolations()
                .forEach(violation -> details.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage()));
        return validationFailure(details, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String reason = "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName();
        return respond(ErrorCode.BAD_REQUEST, reason, List.of(reason), false, null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Malformed request body", List.of(), false, null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, ex.getMessage(), List.of(), false, null, request);
    }

    // ==== Staging failures ====

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("{} {} failed: {} {}", request.getMethod(), request.getRequestURI(), ex.getMessage(),
                    ex.getReasons(), ex);
        } else {
            log.warn("{} {} refused: {} {}", request.getMethod(), request.getRequestURI(), ex.getMessage(),
                    ex.getReasons());
        }
        return respond(errorCode, ex.getMessage(), ex.getReasons(), ex.isRetryable(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", List.of(), false, null, request);
    }

    // ==== Helpers ====

    private ResponseEntity<ApiErrorResponse> validationFailure(Map<String, Object> details, HttpServletRequest request) {
        List<String> reasons = details.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .toList();
        return respond(ErrorCode.VALIDATION_ERROR, "Validation failed", reasons, false, details, request);
    }

    private ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode,
            String message,
            List<String> reasons,
            boolean retryable,
            Map<String, Object> details,
            HttpServletRequest request) {
        ApiErrorResponse response =
                ApiErrorResponse.of(errorCode, message, reasons, retryable, details, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
