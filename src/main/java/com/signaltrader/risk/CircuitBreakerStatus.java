package com.signaltrader.risk;

import com.signaltrader.domain.enums.CircuitBreakerState;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Snapshot of the circuit breaker and the counters it watches. */
@Value
@Builder
public class CircuitBreakerStatus {

    CircuitBreakerState state;
    LocalDate tradingDay;
    BigDecimal dailyRealizedPnl;
    BigDecimal dailyLossLimitAmount;
    int consecutiveLosses;
    int maxConsecutiveLosses;
    boolean emergencyStopActive;
}
