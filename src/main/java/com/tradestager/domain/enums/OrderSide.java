package com.tradestager.domain.enums;

/** Buy or sell side of an option leg. */
public enum OrderSide {
    BUY,
    SELL
}
