package com.signaltrader.recovery;

import com.signaltrader.domain.enums.CircuitBreakerState;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence: what the ledger replay produced and whether
 * decision cycles were started.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    // Step 1: Ledger replay
    private long lastSequenceId;
    private BigDecimal equity;
    private BigDecimal dailyRealizedPnl;
    private int consecutiveLosses;

    // Step 2: Positions
    private int openPositionsRestored;

    // Step 3: Circuit breaker
    private CircuitBreakerState breakerState;

    // Step 4: Exchange balance check
    private BigDecimal exchangeEquity;
    private boolean exchangeBalanceChecked;

    // Step 5: Cycles
    private boolean cyclesStarted;
}
