package com.signaltrader.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.LedgerEntryType;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.LedgerEntry;
import com.signaltrader.ledger.AccountStateReducer;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AccountStateReducerTest {

    private static final Instant DAY_ONE = Instant.parse("2025-03-10T10:00:00Z");
    private static final Instant DAY_TWO = Instant.parse("2025-03-11T10:00:00Z");

    private long sequence = 0;

    @Test
    @DisplayName("Consecutive losses count forward and reset on a win")
    void consecutiveLossesResetOnWin() {
        List<LedgerEntry> entries = List.of(
                closed("P-1", "-5", DAY_ONE), closed("P-2", "-5", DAY_ONE), closed("P-3", "3", DAY_ONE),
                closed("P-4", "-1", DAY_ONE));

        AccountState state = replay(entries);

        assertThat(state.getConsecutiveLosses()).isEqualTo(1);
        assertThat(state.getClosedTradeCount()).isEqualTo(4);
        assertThat(state.getEquity()).isEqualByComparingTo("992");
    }

    @Test
    @DisplayName("A break-even trade neither extends nor ends a losing streak")
    void breakEvenIsNeutral() {
        AccountState state = replay(List.of(
                closed("P-1", "-5", DAY_ONE), closed("P-2", "0", DAY_ONE), closed("P-3", "-2", DAY_ONE)));

        assertThat(state.getConsecutiveLosses()).isEqualTo(2);
        assertThat(replay(List.of(closed("P-1", "0", DAY_ONE))).getConsecutiveLosses()).isZero();
    }

    @Test
    @DisplayName("Open and close move margin in and out of open exposure")
    void exposureFollowsOpenAndClose() {
        AccountState opened = replay(List.of(opened("P-1", "120", DAY_ONE)));
        assertThat(opened.getAvailableMargin()).isEqualByComparingTo("880");

        AccountState closed = replay(List.of(opened("P-1", "120", DAY_ONE), closed("P-1", "10", DAY_ONE)));
        assertThat(closed.getOpenPositionCount()).isZero();
        assertThat(closed.getAvailableMargin()).isEqualByComparingTo("1010");
    }

    @Test
    @DisplayName("Daily PnL only counts trades of the current trading day")
    void dailyPnlPerDay() {
        AccountState state = replay(List.of(closed("P-1", "-30", DAY_ONE), closed("P-2", "-10", DAY_TWO)));

        assertThat(state.getTradingDay()).isEqualTo(LocalDate.of(2025, 3, 11));
        assertThat(state.getDailyRealizedPnl()).isEqualByComparingTo("-10");
        assertThat(state.getEquityAtDayStart()).isEqualByComparingTo("970");
    }

    @Test
    @DisplayName("A daily latch expires the next day; a streak latch holds until reset")
    void latchLifetimes() {
        AccountState daily = replay(List.of(trip(CircuitBreakerState.TRIPPED_DAILY, DAY_ONE)));
        assertThat(daily.activeLatch(LocalDate.of(2025, 3, 10))).isEqualTo(CircuitBreakerState.TRIPPED_DAILY);
        assertThat(daily.activeLatch(LocalDate.of(2025, 3, 11))).isNull();

        AccountState streak = replay(List.of(trip(CircuitBreakerState.TRIPPED_STREAK, DAY_ONE)));
        assertThat(streak.activeLatch(LocalDate.of(2025, 3, 20))).isEqualTo(CircuitBreakerState.TRIPPED_STREAK);

        List<LedgerEntry> withReset = new ArrayList<>();
        withReset.add(closed("P-1", "-1", DAY_ONE));
        withReset.add(trip(CircuitBreakerState.TRIPPED_STREAK, DAY_ONE));
        withReset.add(LedgerEntry.builder()
                .sequenceId(++sequence)
                .entryType(LedgerEntryType.CIRCUIT_BREAKER_RESET)
                .recordedAt(DAY_ONE)
                .breakerState(CircuitBreakerState.ARMED)
                .build());
        AccountState reset = replay(withReset);
        assertThat(reset.activeLatch(LocalDate.of(2025, 3, 10))).isNull();
        assertThat(reset.getConsecutiveLosses()).isZero();
    }

    @Test
    @DisplayName("Rejections change nothing but the sequence id")
    void rejectionIsAuditOnly() {
        AccountState before = replay(List.of(opened("P-1", "100", DAY_ONE)));
        LedgerEntry rejection = LedgerEntry.builder()
                .sequenceId(++sequence)
                .entryType(LedgerEntryType.INTENT_REJECTED)
                .recordedAt(DAY_ONE)
                .symbol("BTCUSDT")
                .build();

        AccountState after = AccountStateReducer.apply(before, rejection, ZoneOffset.UTC);

        assertThat(after.getEquity()).isEqualByComparingTo(before.getEquity());
        assertThat(after.getOpenExposures()).isEqualTo(before.getOpenExposures());
        assertThat(after.getLastSequenceId()).isEqualTo(sequence);
    }

    private AccountState replay(List<LedgerEntry> entries) {
        return AccountStateReducer.replay(AccountState.initial(new BigDecimal("1000"), null), entries, ZoneOffset.UTC);
    }

    private LedgerEntry opened(String positionId, String margin, Instant at) {
        return LedgerEntry.builder()
                .sequenceId(++sequence)
                .entryType(LedgerEntryType.POSITION_OPENED)
                .recordedAt(at)
                .positionId(positionId)
                .symbol("BTCUSDT")
                .positionSize(new BigDecimal(margin))
                .build();
    }

    private LedgerEntry closed(String positionId, String pnl, Instant at) {
        return LedgerEntry.builder()
                .sequenceId(++sequence)
                .entryType(LedgerEntryType.TRADE_CLOSED)
                .recordedAt(at)
                .positionId(positionId)
                .symbol("BTCUSDT")
                .realizedPnl(new BigDecimal(pnl))
                .build();
    }

    private LedgerEntry trip(CircuitBreakerState state, Instant at) {
        return LedgerEntry.builder()
                .sequenceId(++sequence)
                .entryType(LedgerEntryType.CIRCUIT_BREAKER_TRIPPED)
                .recordedAt(at)
                .breakerState(state)
                .build();
    }
}
