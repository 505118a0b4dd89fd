package com.tradestager.repository;

/** Outcome of a write against the staging ledger. */
public enum LedgerOutcome {
    APPLIED,
    /** Duplicate id on insert, or the stored status did not match the expected status. */
    CONFLICT,
    NOT_FOUND,
    /** The record exists but has been moved to history and can no longer change. */
    ARCHIVED,
    /** History move requested for an order that is not in a terminal status. */
    NOT_TERMINAL
}
