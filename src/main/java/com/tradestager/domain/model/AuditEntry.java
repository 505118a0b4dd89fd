package com.tradestager.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/** One append-only entry in an order's audit trail. */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class AuditEntry {

    private final Instant timestamp;

    /** Order the entry belongs to. Lets per-strategy trails be merged across orders. */
    private final String orderId;

    /** What happened (e.g., "STAGED", "APPROVED", "ROLLED_BACK"). */
    private final String event;

    /** Who caused it (user id, "api", "risk-sweep"). */
    private final String actor;

    private final String note;
}
