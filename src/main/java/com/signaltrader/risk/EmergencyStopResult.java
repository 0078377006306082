package com.signaltrader.risk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Result of an emergency stop activation.
 *
 * <p>Position closes are best effort; failures are collected in {@code errors} and the
 * halt stays in force regardless.
 */
@Data
@Builder
public class EmergencyStopResult {

    private boolean success;
    private boolean alreadyActive;
    private boolean closePositions;
    private int positionsClosed;
    private int positionsFailed;
    private String reason;
    private Instant activatedAt;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
