package com.tradestager.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Realized P&L of a closed trade. {@code tradeDate} defaults to today in the trade-date zone. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeResultRequest {

    @NotNull
    private BigDecimal pnl;

    private LocalDate tradeDate;
}
