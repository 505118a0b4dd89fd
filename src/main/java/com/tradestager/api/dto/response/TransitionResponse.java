package com.tradestager.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Orders as stored after a successful transition. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransitionResponse {

    private String strategyId;
    private String orderId;
    private List<OrderResponse> orders;
}
