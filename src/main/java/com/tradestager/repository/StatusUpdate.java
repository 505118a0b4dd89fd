package com.tradestager.repository;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.AuditEntry;
import com.tradestager.domain.model.OrderRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The change a compare-and-set writes when the expected status matches: the new status, the
 * audit entry to append, and the optional submission/fill fields.
 */
@Getter
@Builder
@ToString
public class StatusUpdate {

    private final OrderStatus newStatus;
    private final AuditEntry auditEntry;

    /** Set on submission; null leaves the stored value unchanged. */
    private final String brokerRef;

    /** Set on fills; null leaves the stored value unchanged. */
    private final BigDecimal filledPrice;

    /** Set on fills; null leaves the stored value unchanged. */
    private final Integer filledQuantity;

    /**
     * When set, the write also requires the stored version to equal this value. Used by writes
     * whose status does not change (a partial fill on a partially filled order).
     */
    private final Long expectedVersion;

    /** True if {@code current} satisfies this update's version precondition. */
    public boolean versionMatches(OrderRecord current) {
        return expectedVersion == null || expectedVersion == current.getVersion();
    }

    /** Returns a new record with this update applied. The input is not modified. */
    public OrderRecord applyTo(OrderRecord current) {
        List<AuditEntry> trail = new ArrayList<>(current.getAuditTrail() != null ? current.getAuditTrail() : List.of());
        trail.add(auditEntry);

        OrderRecord.OrderRecordBuilder builder = current.toBuilder()
                .status(newStatus)
                .version(current.getVersion() + 1)
                .updatedAt(auditEntry.getTimestamp())
                .auditTrail(List.copyOf(trail));
        if (brokerRef != null) {
            builder.brokerRef(brokerRef);
        }
        if (filledPrice != null) {
            builder.filledPrice(filledPrice);
        }
        if (filledQuantity != null) {
            builder.filledQuantity(filledQuantity);
        }
        return builder.build();
    }
}
