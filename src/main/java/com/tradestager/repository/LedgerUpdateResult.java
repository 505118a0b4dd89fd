package com.tradestager.repository;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.OrderRecord;
import lombok.Getter;

/**
 * Result of a ledger write.
 *
 * <p>{@code record} is the stored order after the write when applied, or the order as observed
 * when the write was refused (null for inserts and missing ids). {@code observedStatus} is the
 * status the ledger held at the time of the refusal, useful for conflict messages.
 */
@Getter
public class LedgerUpdateResult {

    private final LedgerOutcome outcome;
    private final OrderRecord record;
    private final OrderStatus observedStatus;

    private LedgerUpdateResult(LedgerOutcome outcome, OrderRecord record, OrderStatus observedStatus) {
        this.outcome = outcome;
        this.record = record;
        this.observedStatus = observedStatus;
    }

    public static LedgerUpdateResult applied(OrderRecord record) {
        return new LedgerUpdateResult(LedgerOutcome.APPLIED, record, record != null ? record.getStatus() : null);
    }

    public static LedgerUpdateResult applied() {
        return new LedgerUpdateResult(LedgerOutcome.APPLIED, null, null);
    }

    public static LedgerUpdateResult conflict(OrderRecord observed) {
        return new LedgerUpdateResult(LedgerOutcome.CONFLICT, observed, observed != null ? observed.getStatus() : null);
    }

    public static LedgerUpdateResult notFound() {
        return new LedgerUpdateResult(LedgerOutcome.NOT_FOUND, null, null);
    }

    public static LedgerUpdateResult archived(OrderRecord observed) {
        return new LedgerUpdateResult(LedgerOutcome.ARCHIVED, observed, observed != null ? observed.getStatus() : null);
    }

    public static LedgerUpdateResult notTerminal(OrderRecord observed) {
        return new LedgerUpdateResult(
                LedgerOutcome.NOT_TERMINAL, observed, observed != null ? observed.getStatus() : null);
    }

    public boolean isApplied() {
        return outcome == LedgerOutcome.APPLIED;
    }
}
