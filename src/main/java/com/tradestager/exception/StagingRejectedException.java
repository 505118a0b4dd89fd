package com.tradestager.exception;

import java.util.List;
import java.util.Map;

/**
 * Raised at the REST boundary when a lifecycle operation returns a typed failure, so the
 * failure reaches the client as an error envelope carrying every reason.
 */
public class StagingRejectedException extends BaseException {

    private final boolean retryable;

    public StagingRejectedException(
            ErrorCode errorCode, String message, List<String> reasons, boolean retryable, Map<String, Object> details) {
        super(errorCode, message, reasons, details, null);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
