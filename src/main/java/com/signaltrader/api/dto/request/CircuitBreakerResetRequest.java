package com.signaltrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CircuitBreakerResetRequest {

    /** Who re-armed the breaker; written to the ledger reset entry. */
    @NotBlank
    private String operator;
}
