package com.signaltrader.domain.model;

import com.signaltrader.domain.enums.CircuitBreakerState;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Account view derived by folding the trade ledger.
 *
 * <p>Instances are immutable; every ledger entry produces a new state. The live state held
 * by the account state service and a full replay of the ledger go through the same reducer,
 * so they are equal for the same entry sequence.
 *
 * <p>{@code latchedBreakerState} carries the last circuit breaker trip that has not been
 * reset. A daily trip expires on its own at the next trading day; streak and manual trips
 * stay latched until a reset entry is written.
 */
@Value
@Builder(toBuilder = true)
public class AccountState {

    BigDecimal equity;
    BigDecimal equityAtDayStart;
    LocalDate tradingDay;
    BigDecimal dailyRealizedPnl;
    int consecutiveLosses;
    Map<String, OpenExposure> openExposures;
    CircuitBreakerState latchedBreakerState;
    LocalDate latchedOn;
    long lastSequenceId;
    int closedTradeCount;

    public static AccountState initial(BigDecimal initialEquity, LocalDate tradingDay) {
        return AccountState.builder()
                .equity(initialEquity)
                .equityAtDayStart(initialEquity)
                .tradingDay(tradingDay)
                .dailyRealizedPnl(BigDecimal.ZERO)
                .consecutiveLosses(0)
                .openExposures(Map.of())
                .lastSequenceId(0L)
                .closedTradeCount(0)
                .build();
    }

    /** Equity not committed as margin to open positions. */
    public BigDecimal getAvailableMargin() {
        BigDecimal committed = openExposures.values().stream()
                .map(OpenExposure::getMargin)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return equity.subtract(committed);
    }

    public Set<String> getOpenPositionIds() {
        return openExposures.keySet();
    }

    public int getOpenPositionCount() {
        return openExposures.size();
    }

    public long openPositionCount(String symbol) {
        return openExposures.values().stream()
                .filter(exposure -> exposure.getSymbol().equals(symbol))
                .count();
    }

    /**
     * Returns this state as seen on {@code day}. Moving to a later day zeroes the daily
     * realized PnL and snapshots equity as the new start-of-day equity.
     */
    public AccountState rollTo(LocalDate day) {
        if (tradingDay == null || day.isAfter(tradingDay)) {
            return toBuilder()
                    .tradingDay(day)
                    .equityAtDayStart(equity)
                    .dailyRealizedPnl(BigDecimal.ZERO)
                    .build();
        }
        return this;
    }

    /**
     * The latched breaker trip still in force on {@code today}, or null if none.
     * A daily trip only holds for the day it was recorded on.
     */
    public CircuitBreakerState activeLatch(LocalDate today) {
        if (latchedBreakerState == null) {
            return null;
        }
        if (latchedBreakerState == CircuitBreakerState.TRIPPED_DAILY
                && (latchedOn == null || latchedOn.isBefore(today))) {
            return null;
        }
        return latchedBreakerState;
    }
}
