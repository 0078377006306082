package com.signaltrader.api.dto.response;

import com.signaltrader.domain.enums.CircuitBreakerState;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountSummaryResponse {

    BigDecimal equity;
    BigDecimal availableMargin;
    BigDecimal equityAtDayStart;
    LocalDate tradingDay;
    BigDecimal dailyRealizedPnl;
    int consecutiveLosses;
    int openPositionCount;
    int closedTradeCount;
    long lastSequenceId;
    int pendingLedgerWrites;
    CircuitBreakerState circuitBreakerState;
}
