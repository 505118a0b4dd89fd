package com.tradestager.event;

/** Strategy-level lifecycle events. */
public enum StrategyEventType {
    /** Strategy passed structure and risk checks and its orders were written as STAGED. */
    STAGED,
    APPROVED,
    REJECTED,
    CANCELLED,
    /** All orders reached a terminal status and the strategy was moved to history. */
    ARCHIVED
}
