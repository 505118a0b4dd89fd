package com.tradestager.domain.enums;

/** Call or put. */
public enum OptionType {
    CALL,
    PUT
}
