package com.tradestager.event;

/** Per-order execution events reported back by the broker collaborator. */
public enum OrderEventType {
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED
}
