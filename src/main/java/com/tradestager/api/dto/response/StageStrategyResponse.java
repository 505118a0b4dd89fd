package com.tradestager.api.dto.response;

import com.tradestager.risk.RiskAssessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Returned when a candidate has been staged. Warnings are inside the assessment. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StageStrategyResponse {

    private String strategyId;
    private RiskAssessment assessment;
}
