package com.signaltrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EmergencyStopRequest {

    @NotBlank
    private String reason;

    /** When true every open position is closed at market after trading halts. */
    private boolean closePositions = true;
}
