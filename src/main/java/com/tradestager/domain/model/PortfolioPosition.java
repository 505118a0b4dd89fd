package com.tradestager.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/** A held position within a {@link PortfolioSnapshot}. Negative quantity means short. */
@Getter
@Builder
@Jacksonized
@ToString
public class PortfolioPosition {

    private final String symbol;
    private final int quantity;
    private final BigDecimal averageCost;
}
