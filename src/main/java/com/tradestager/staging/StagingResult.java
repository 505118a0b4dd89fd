package com.tradestager.staging;

import com.tradestager.risk.RiskAssessment;
import com.tradestager.strategy.StructuralViolation;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of {@link LifecycleController#stageStrategy}.
 *
 * <p>On success {@code strategyId} names the new strategy and {@code assessment} holds the risk
 * assessment it was staged under (including any warnings). On failure {@code errorType} says
 * why and {@code reasons} lists every violated rule or limit; {@code assessment} is set for
 * risk rejections and {@code structuralViolations} for structural errors.
 */
@Getter
@Builder
@ToString
public class StagingResult {

    private final boolean success;
    private final String strategyId;
    private final StagingErrorType errorType;

    @Builder.Default
    private final List<String> reasons = List.of();

    private final RiskAssessment assessment;

    @Builder.Default
    private final List<StructuralViolation> structuralViolations = List.of();

    public static StagingResult staged(String strategyId, RiskAssessment assessment) {
        return StagingResult.builder()
                .success(true)
                .strategyId(strategyId)
                .assessment(assessment)
                .build();
    }

    public static StagingResult structuralError(List<StructuralViolation> violations) {
        return StagingResult.builder()
                .success(false)
                .errorType(StagingErrorType.STRUCTURAL_ERROR)
                .reasons(violations.stream().map(StructuralViolation::getMessage).toList())
                .structuralViolations(List.copyOf(violations))
                .build();
    }

    public static StagingResult riskRejected(RiskAssessment assessment) {
        return StagingResult.builder()
                .success(false)
                .errorType(StagingErrorType.RISK_REJECTED)
                .reasons(assessment.getViolationMessages())
                .assessment(assessment)
                .build();
    }

    public static StagingResult failure(StagingErrorType errorType, String reason) {
        return StagingResult.builder()
                .success(false)
                .errorType(errorType)
                .reasons(List.of(reason))
                .build();
    }
}
