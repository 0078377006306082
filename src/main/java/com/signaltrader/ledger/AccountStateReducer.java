package com.signaltrader.ledger;

import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.LedgerEntry;
import com.signaltrader.domain.model.OpenExposure;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds ledger entries into {@link AccountState}.
 *
 * <p>Both startup replay and the live account state service call {@link #apply}, so the
 * state after N live writes equals the state from replaying the same N entries.
 *
 * <p>Consecutive losses are counted forward: a losing trade increments, a winning trade
 * resets to zero and a break-even trade leaves the count unchanged. This is the same number
 * as counting trailing losses backwards from the newest trade up to the first win. A breaker
 * reset entry also zeroes the count.
 */
public final class AccountStateReducer {

    private AccountStateReducer() {}

    public static AccountState replay(AccountState initial, List<LedgerEntry> entries, ZoneId zone) {
        AccountState state = initial;
        for (LedgerEntry entry : entries) {
            state = apply(state, entry, zone);
        }
        return state;
    }

    public static AccountState apply(AccountState state, LedgerEntry entry, ZoneId zone) {
        LocalDate entryDay = LocalDate.ofInstant(entry.getRecordedAt(), zone);
        AccountState rolled = state.rollTo(entryDay);
        AccountState.AccountStateBuilder next = rolled.toBuilder();
        if (entry.getSequenceId() != null) {
            next.lastSequenceId(entry.getSequenceId());
        }

        switch (entry.getEntryType()) {
            case POSITION_OPENED -> {
                Map<String, OpenExposure> exposures = new LinkedHashMap<>(rolled.getOpenExposures());
                exposures.put(entry.getPositionId(), OpenExposure.of(entry.getSymbol(), entry.getPositionSize()));
                next.openExposures(Collections.unmodifiableMap(exposures));
            }
            case TRADE_CLOSED -> {
                Map<String, OpenExposure> exposures = new LinkedHashMap<>(rolled.getOpenExposures());
                exposures.remove(entry.getPositionId());
                next.openExposures(Collections.unmodifiableMap(exposures))
                        .equity(rolled.getEquity().add(entry.getRealizedPnl()))
                        .dailyRealizedPnl(rolled.getDailyRealizedPnl().add(entry.getRealizedPnl()))
                        .consecutiveLosses(nextStreak(rolled.getConsecutiveLosses(), entry.getRealizedPnl()))
                        .closedTradeCount(rolled.getClosedTradeCount() + 1);
            }
            case CIRCUIT_BREAKER_TRIPPED -> next.latchedBreakerState(entry.getBreakerState())
                    .latchedOn(entryDay);
            case CIRCUIT_BREAKER_RESET -> next.latchedBreakerState(null)
                    .latchedOn(null)
                    .consecutiveLosses(0);
            case INTENT_REJECTED -> {
                // audit only
            }
        }
        return next.build();
    }

    private static int nextStreak(int streak, BigDecimal realizedPnl) {
        int sign = realizedPnl.signum();
        if (sign < 0) {
            return streak + 1;
        }
        return sign > 0 ? 0 : streak;
    }
}
