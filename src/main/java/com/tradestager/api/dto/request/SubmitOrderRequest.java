package com.tradestager.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Reported by the broker collaborator once an approved order has been accepted. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmitOrderRequest {

    @NotBlank
    private String brokerRef;

    private String actor;
}
