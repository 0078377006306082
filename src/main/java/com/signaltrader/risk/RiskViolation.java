package com.signaltrader.risk;

import com.signaltrader.domain.enums.RejectionReason;
import lombok.Builder;
import lombok.Getter;

/**
 * A single reason a trade intent failed pre-trade checks.
 * Several may be reported at once; the first is the decision's primary reason.
 */
@Getter
@Builder
public class RiskViolation {

    private final RejectionReason reason;

    /** Human-readable description including the numbers that failed. */
    private final String message;

    public static RiskViolation of(RejectionReason reason, String message) {
        return RiskViolation.builder().reason(reason).message(message).build();
    }

    @Override
    public String toString() {
        return reason.getCode() + ": " + message;
    }
}
