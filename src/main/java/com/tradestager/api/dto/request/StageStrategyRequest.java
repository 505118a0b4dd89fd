package com.tradestager.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for staging a strategy candidate together with the portfolio snapshot
 * it should be assessed against.
 *
 * <p>{@code archetype} is the snake_case code (e.g. "iron_condor"). An unknown code is not a
 * validation error here; it reaches the structural validator and comes back as
 * "unsupported archetype".
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StageStrategyRequest {

    private String candidateId;

    @NotBlank
    private String symbol;

    @NotBlank
    private String archetype;

    @NotNull
    @Valid
    private List<LegRequest> legs;

    @NotNull
    private BigDecimal declaredMaxRisk;

    private BigDecimal declaredMaxProfit;

    private Map<String, String> metadata;

    @Valid
    private PortfolioRequest portfolio;

    private String actor;
}
