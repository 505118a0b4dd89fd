package com.tradestager.domain.model;

import com.tradestager.risk.RiskAssessment;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * A successfully staged strategy: the candidate, its risk assessment at staging time, and
 * the ids of its constituent orders.
 *
 * <p>The aggregate status is not stored; see {@link StrategySnapshot}.
 */
@Getter
@Builder
@Jacksonized
@ToString
public class StrategyRecord {

    private final String id;
    private final StrategyCandidate candidate;
    private final RiskAssessment assessment;
    private final List<String> orderIds;
    private final Instant createdAt;
}
