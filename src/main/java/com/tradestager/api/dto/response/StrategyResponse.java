package com.tradestager.api.dto.response;

import com.tradestager.domain.enums.StrategyStatus;
import com.tradestager.risk.RiskAssessment;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API response DTO for a staged strategy with its orders and derived status. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyResponse {

    private String id;
    private String candidateId;
    private String symbol;
    private String archetype;
    private BigDecimal declaredMaxRisk;
    private StrategyStatus aggregateStatus;
    private boolean archived;
    private Instant createdAt;
    private RiskAssessment assessment;
    private List<OrderResponse> orders;
}
