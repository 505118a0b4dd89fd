package com.tradestager.api.dto.request;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One leg of a {@link StageStrategyRequest}. Strike and quantity are checked by the structural validator. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LegRequest {

    @NotNull
    private OrderSide side;

    @NotNull
    private OptionType optionType;

    @NotNull
    private BigDecimal strike;

    @NotNull
    private Integer quantity;
}
