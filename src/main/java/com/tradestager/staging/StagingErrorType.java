package com.tradestager.staging;

import com.tradestager.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Why a lifecycle operation did not apply. */
@Getter
@RequiredArgsConstructor
public enum StagingErrorType {
    /** Candidate breaks one or more archetype rules. Resubmit a corrected candidate. */
    STRUCTURAL_ERROR(ErrorCode.STRUCTURAL_ERROR, false),
    /** Candidate breaks one or more risk limits. Carries the full assessment. */
    RISK_REJECTED(ErrorCode.RISK_LIMIT_EXCEEDED, false),
    NOT_FOUND(ErrorCode.NOT_FOUND, false),
    /** The transition is not legal from the current status. The caller's view is stale or wrong. */
    INVALID_TRANSITION(ErrorCode.INVALID_TRANSITION, false),
    /** Missing or non-positive arguments (fill price, fill quantity, broker reference). */
    INVALID_REQUEST(ErrorCode.BAD_REQUEST, false),
    /** A concurrent writer changed the order first. */
    STAGING_CONFLICT(ErrorCode.CONFLICT, true),
    /** Approval lost a race on one order; every order already approved was put back to STAGED. */
    PARTIAL_APPROVAL_CONFLICT(ErrorCode.CONFLICT, true),
    /** The ledger could not confirm the write. Nothing is reported as applied. */
    BACKEND_UNAVAILABLE(ErrorCode.BACKEND_UNAVAILABLE, true);

    private final ErrorCode errorCode;

    /** True if the same call may succeed when retried (with backoff) by the caller. */
    private final boolean retryable;
}
