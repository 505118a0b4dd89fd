package com.tradestager.api.dto.response;

import com.tradestager.domain.enums.OptionType;
import com.tradestager.domain.enums.OrderSide;
import com.tradestager.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** REST API response DTO for a staged order, with its leg flattened. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderResponse {

    private String id;
    private String strategyId;
    private String symbol;
    private int legIndex;
    private OrderSide side;
    private OptionType optionType;
    private BigDecimal strike;
    private int quantity;
    private OrderStatus status;
    private String brokerRef;
    private BigDecimal filledPrice;
    private int filledQuantity;
    private Instant createdAt;
    private Instant updatedAt;
}
