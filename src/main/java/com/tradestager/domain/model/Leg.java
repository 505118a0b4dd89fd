package com.tradestager.domain.model;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * One option contract within a multi-leg strategy candidate.
 *
 * <p>Immutable once attached to a candidate. Quantity is always positive; direction is
 * carried by {@link #side} rather than by sign.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
public class Leg {

    private final OrderSide side;

    private final OptionType optionType;

    /** Strike price, strictly positive. */
    private final BigDecimal strike;

    /** Number of contracts, strictly positive. */
    private final int quantity;
}
