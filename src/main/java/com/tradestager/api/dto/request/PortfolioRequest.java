package com.tradestager.api.dto.request;

import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Portfolio snapshot supplied by the caller for a single staging call. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioRequest {

    private BigDecimal equity;
    private BigDecimal cash;

    @Valid
    private List<PositionRequest> positions;

    /** Realized loss per trade date, positive amounts. */
    private Map<LocalDate, BigDecimal> dailyRealizedLoss;
}
