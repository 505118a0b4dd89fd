package com.tradestager.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes of the staging API with the HTTP status they map to. {@code retryable} codes tell
 * the client that the same request may succeed later, with backoff.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    /** Status does not allow the requested transition. */
    INVALID_TRANSITION("INVALID_TRANSITION", 409, false),
    /** A concurrent writer won the compare-and-set. */
    CONFLICT("CONFLICT", 409, true),
    STRUCTURAL_ERROR("STRUCTURAL_ERROR", 422, false),
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    /** Ledger backend unreachable; nothing was applied. */
    BACKEND_UNAVAILABLE("BACKEND_UNAVAILABLE", 503, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
