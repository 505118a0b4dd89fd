package com.tradestager.exception;

/**
 * Thrown by a staging ledger or daily loss tracker when its backing store cannot be reached
 * or refuses the operation. The lifecycle controller treats it as fail-closed: nothing is
 * reported as applied unless the backend confirmed it.
 */
public class LedgerUnavailableException extends BaseException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message, cause);
    }
}
