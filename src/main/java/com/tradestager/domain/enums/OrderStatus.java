package com.tradestager.domain.enums;

/**
 * Lifecycle status of a staged order.
 *
 * <p>Transitions: PENDING → STAGED → APPROVED → SUBMITTED → (PARTIALLY_FILLED →) FILLED.
 * STAGED/APPROVED may also move to REJECTED or CANCELLED. PENDING exists only while a
 * strategy is being staged and is never stored. FILLED, REJECTED and CANCELLED are terminal.
 */
public enum OrderStatus {
    PENDING,
    STAGED,
    APPROVED,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELLED;
    }

    /**
     * Returns true if moving from this status to {@code next} is a forward lifecycle edge.
     * The APPROVED → STAGED compensation is not a forward edge; only strategy-level rollback
     * in the lifecycle controller issues it.
     */
    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case PENDING -> next == STAGED;
            case STAGED -> next == APPROVED || next == REJECTED || next == CANCELLED;
            case APPROVED -> next == SUBMITTED || next == REJECTED || next == CANCELLED;
            case SUBMITTED -> next == PARTIALLY_FILLED || next == FILLED;
            case PARTIALLY_FILLED -> next == PARTIALLY_FILLED || next == FILLED;
            case FILLED, REJECTED, CANCELLED -> false;
        };
    }
}
