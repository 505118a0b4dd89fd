package com.tradestager.risk;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * A single risk limit violation detected while assessing a strategy candidate.
 *
 * <p>Each violation has a code (machine-readable) and a message (human-readable).
 * Codes: POSITION_SIZE_EXCEEDED, PER_TRADE_LOSS_EXCEEDED, PORTFOLIO_EXPOSURE_EXCEEDED,
 * DAILY_LOSS_LIMIT_EXCEEDED, INSUFFICIENT_SHARES, SPREAD_TOO_WIDE, INVALID_CONTRACT_MULTIPLIER,
 * MAX_RISK_UNDECLARED, CAPITAL_AT_RISK_EXCEEDED, POSITION_COUNT_EXCEEDED,
 * SYMBOL_POSITION_COUNT_EXCEEDED, SYMBOL_BLACKOUT.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
public class RiskViolation {

    public static final String POSITION_SIZE_EXCEEDED = "POSITION_SIZE_EXCEEDED";
    public static final String PER_TRADE_LOSS_EXCEEDED = "PER_TRADE_LOSS_EXCEEDED";
    public static final String PORTFOLIO_EXPOSURE_EXCEEDED = "PORTFOLIO_EXPOSURE_EXCEEDED";
    public static final String DAILY_LOSS_LIMIT_EXCEEDED = "DAILY_LOSS_LIMIT_EXCEEDED";
    public static final String INSUFFICIENT_SHARES = "INSUFFICIENT_SHARES";
    public static final String SPREAD_TOO_WIDE = "SPREAD_TOO_WIDE";
    public static final String INVALID_CONTRACT_MULTIPLIER = "INVALID_CONTRACT_MULTIPLIER";
    public static final String MAX_RISK_UNDECLARED = "MAX_RISK_UNDECLARED";
    public static final String CAPITAL_AT_RISK_EXCEEDED = "CAPITAL_AT_RISK_EXCEEDED";
    public static final String POSITION_COUNT_EXCEEDED = "POSITION_COUNT_EXCEEDED";
    public static final String SYMBOL_POSITION_COUNT_EXCEEDED = "SYMBOL_POSITION_COUNT_EXCEEDED";
    public static final String SYMBOL_BLACKOUT = "SYMBOL_BLACKOUT";

    /** Machine-readable violation code (e.g., "POSITION_SIZE_EXCEEDED"). */
    private final String code;

    /** Human-readable description of the violation. */
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
