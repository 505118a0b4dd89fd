package com.tradestager.domain.model;

import com.tradestager.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * One staged order, corresponding to a single leg of a staged strategy.
 *
 * <p>Instances are immutable snapshots. The staging ledger replaces the stored snapshot on
 * every successful compare-and-set; callers only ever see read-only projections.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@EqualsAndHashCode
@ToString
public class OrderRecord {

    private final String id;
    private final String strategyId;

    /** Underlying symbol, copied from the candidate for filtering. */
    private final String symbol;

    /** Position of the leg within the candidate's leg list. */
    private final int legIndex;

    private final Leg leg;

    private final OrderStatus status;

    private final Instant createdAt;
    private final Instant updatedAt;

    /** Broker reference set on submission. Null before SUBMITTED. */
    private final String brokerRef;

    /** Quantity-weighted average fill price. Null until the first fill. */
    private final BigDecimal filledPrice;

    private final int filledQuantity;

    /** Incremented on every applied write; lets writers detect updates that kept the status. */
    private final long version;

    private final List<AuditEntry> auditTrail;
}
