package com.tradestager.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the staging exceptions that reach the REST layer. Carries the {@link ErrorCode} that
 * decides the HTTP status, optional details for the error envelope and the list of reasons
 * (violated rules or limits) when there is more than one.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;
    private final List<String> reasons;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, List.of(), details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, List.of(), Map.of(), cause);
    }

    protected BaseException(
            ErrorCode errorCode, String message, List<String> reasons, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of();
        this.details = details != null ? details : Map.of();
    }

    /** Whether the client may repeat the request. Defaults to the error code's policy. */
    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
