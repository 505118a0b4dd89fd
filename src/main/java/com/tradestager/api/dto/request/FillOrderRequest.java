package com.tradestager.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One execution report. Several may arrive for the same order. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillOrderRequest {

    @NotNull
    @Positive
    private BigDecimal price;

    @NotNull
    @Positive
    private Integer quantity;

    private String actor;
}
