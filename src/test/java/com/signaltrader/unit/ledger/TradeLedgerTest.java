package com.signaltrader.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.enums.LedgerEntryType;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.PositionStatus;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.LedgerEntry;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.domain.model.TradeIntent;
import com.signaltrader.exception.LedgerWriteException;
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.ledger.TradeLedger;
import com.signaltrader.testsupport.InMemoryLedgerStore;
import com.signaltrader.testsupport.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for TradeLedger and AccountStateService: append semantics, duplicate trade guard,
 * replay producing the same account state as live writes, and state left untouched on
 * failed writes.
 */
class TradeLedgerTest {

    private static final Instant START = Instant.parse("2025-03-10T08:00:00Z");

    private InMemoryLedgerStore store;
    private MutableClock clock;
    private TradingProperties tradingProperties;
    private TradeLedger tradeLedger;
    private AccountStateService accountStateService;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        clock = new MutableClock(START);
        tradingProperties = new TradingProperties();
        tradeLedger = store.newLedger(tradingProperties, clock);
        accountStateService = new AccountStateService(tradeLedger, clock);
    }

    // ==============================
    // APPEND
    // ==============================

    @Nested
    @DisplayName("Append")
    class Append {

        @Test
        @DisplayName("Sequence ids are strictly increasing")
        void sequenceIdsIncrease() {
            LedgerEntry first = tradeLedger.appendPositionOpened(position("P-1", "BTCUSDT"));
            LedgerEntry second =
                    tradeLedger.appendRejection(intent("ETHUSDT"), RejectionReason.BELOW_MIN_ORDER_SIZE, "x");
            LedgerEntry third = tradeLedger.appendBreakerTrip(CircuitBreakerState.TRIPPED_STREAK, "3 losses");

            assertThat(first.getSequenceId()).isLessThan(second.getSequenceId());
            assertThat(second.getSequenceId()).isLessThan(third.getSequenceId());
        }

        @Test
        @DisplayName("A second trade for the same position is not written")
        void duplicateTradeSkipped() {
            tradeLedger.appendPositionOpened(position("P-1", "BTCUSDT"));
            Trade trade = trade("P-1", "BTCUSDT", "-10");

            Optional<LedgerEntry> first = tradeLedger.appendTradeClosed(trade);
            Optional<LedgerEntry> second = tradeLedger.appendTradeClosed(trade);

            assertThat(first).isPresent();
            assertThat(second).isEmpty();
            assertThat(store.count(LedgerEntryType.TRADE_CLOSED)).isEqualTo(1);
        }

        @Test
        @DisplayName("Storage failure surfaces as LedgerWriteException")
        void storageFailureThrows() {
            store.setFailWrites(true);

            assertThatThrownBy(() -> tradeLedger.appendPositionOpened(position("P-1", "BTCUSDT")))
                    .isInstanceOf(LedgerWriteException.class);
        }

        @Test
        @DisplayName("Long rejection detail is truncated to 500 characters")
        void detailTruncated() {
            LedgerEntry entry = tradeLedger.appendRejection(
                    intent("BTCUSDT"), RejectionReason.INSUFFICIENT_MARGIN, "x".repeat(800));

            assertThat(entry.getDetail()).hasSize(500);
        }
    }

    // ==============================
    // QUERIES
    // ==============================

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Open positions are those without a closing trade")
        void openPositionsExcludeClosed() {
            tradeLedger.appendPositionOpened(position("P-1", "BTCUSDT"));
            tradeLedger.appendPositionOpened(position("P-2", "ETHUSDT"));
            tradeLedger.appendTradeClosed(trade("P-1", "BTCUSDT", "5"));

            List<Position> open = tradeLedger.openPositions();

            assertThat(open).extracting(Position::getId).containsExactly("P-2");
            assertThat(open.get(0).getStatus()).isEqualTo(PositionStatus.OPEN);
            assertThat(open.get(0).getStopLossPrice()).isEqualByComparingTo("98");
        }

        @Test
        @DisplayName("Closed trades can be filtered by symbol")
        void closedTradesBySymbol() {
            tradeLedger.appendTradeClosed(trade("P-1", "BTCUSDT", "5"));
            tradeLedger.appendTradeClosed(trade("P-2", "ETHUSDT", "-3"));

            assertThat(tradeLedger.closedTrades()).hasSize(2);
            assertThat(tradeLedger.closedTrades("ETHUSDT"))
                    .singleElement()
                    .satisfies(t -> assertThat(t.getRealizedPnl()).isEqualByComparingTo("-3"));
        }

        @Test
        @DisplayName("Rejection count covers only rejected intents")
        void rejectionCount() {
            tradeLedger.appendRejection(intent("BTCUSDT"), RejectionReason.CIRCUIT_BREAKER_TRIPPED, "halt");
            tradeLedger.appendRejection(intent("BTCUSDT"), RejectionReason.EXECUTION_FAILED, "rejected");
            tradeLedger.appendBreakerReset("ops");

            assertThat(tradeLedger.rejectionCount()).isEqualTo(2);
        }
    }

    // ==============================
    // REPLAY
    // ==============================

    @Nested
    @DisplayName("Replay")
    class Replay {

        @Test
        @DisplayName("Replaying the ledger yields the same state as the live writes")
        void replayMatchesLiveState() {
            accountStateService.recordPositionOpened(position("P-1", "BTCUSDT"));
            accountStateService.recordPositionOpened(position("P-2", "ETHUSDT"));
            accountStateService.recordTradeClosed(trade("P-1", "BTCUSDT", "-12.5"));
            accountStateService.recordRejection(intent("SOLUSDT"), RejectionReason.INSUFFICIENT_MARGIN, "margin");
            accountStateService.recordBreakerTrip(CircuitBreakerState.TRIPPED_STREAK, "streak");

            AccountState live = accountStateService.current();
            AccountState replayed = tradeLedger.replay();

            assertThat(replayed).isEqualTo(live);
            assertThat(live.getEquity()).isEqualByComparingTo("987.5");
            assertThat(live.getOpenPositionIds()).containsExactly("P-2");
            assertThat(live.getConsecutiveLosses()).isEqualTo(1);
            assertThat(live.getLatchedBreakerState()).isEqualTo(CircuitBreakerState.TRIPPED_STREAK);
        }

        @Test
        @DisplayName("Reloading after a restart restores equity and open exposure")
        void reloadAfterRestart() {
            accountStateService.recordPositionOpened(position("P-1", "BTCUSDT"));
            accountStateService.recordTradeClosed(trade("P-1", "BTCUSDT", "40"));
            accountStateService.recordPositionOpened(position("P-2", "BTCUSDT"));

            AccountStateService restarted = new AccountStateService(store.newLedger(tradingProperties, clock), clock);
            AccountState state = restarted.reload();

            assertThat(state.getEquity()).isEqualByComparingTo("1040");
            assertThat(state.getAvailableMargin()).isEqualByComparingTo("940");
            assertThat(state.getClosedTradeCount()).isEqualTo(1);
            assertThat(state.getLastSequenceId()).isEqualTo(3L);
        }

        @Test
        @DisplayName("Daily realized PnL starts from zero on a new trading day")
        void dailyPnlRollsOver() {
            accountStateService.recordTradeClosed(trade("P-1", "BTCUSDT", "-20"));
            assertThat(accountStateService.current().getDailyRealizedPnl()).isEqualByComparingTo("-20");

            clock.advance(Duration.ofDays(1));

            AccountState nextDay = accountStateService.current();
            assertThat(nextDay.getTradingDay()).isEqualTo(LocalDate.of(2025, 3, 11));
            assertThat(nextDay.getDailyRealizedPnl()).isEqualByComparingTo("0");
            assertThat(nextDay.getEquityAtDayStart()).isEqualByComparingTo("980");
        }
    }

    // ==============================
    // FAILED WRITES
    // ==============================

    @Test
    @DisplayName("A failed write leaves account state unchanged")
    void failedWriteLeavesStateUnchanged() {
        accountStateService.recordPositionOpened(position("P-1", "BTCUSDT"));
        AccountState before = accountStateService.current();

        store.setFailWrites(true);
        assertThatThrownBy(() -> accountStateService.recordTradeClosed(trade("P-1", "BTCUSDT", "-50")))
                .isInstanceOf(LedgerWriteException.class);

        assertThat(accountStateService.current()).isEqualTo(before);
    }

    // ==============================
    // FIXTURES
    // ==============================

    private Position position(String id, String symbol) {
        return Position.builder()
                .id(id)
                .symbol(symbol)
                .side(OrderSide.BUY)
                .entryPrice(new BigDecimal("100"))
                .quantity(new BigDecimal("5"))
                .positionSize(new BigDecimal("100"))
                .leverage(new BigDecimal("5"))
                .stopLossPrice(new BigDecimal("98"))
                .takeProfitPrice(new BigDecimal("105"))
                .liquidationPrice(new BigDecimal("80.5"))
                .entryFee(new BigDecimal("0.25"))
                .entryOrderId("ORD-" + id)
                .openedAt(clock.instant())
                .status(PositionStatus.OPEN)
                .build();
    }

    private Trade trade(String positionId, String symbol, String pnl) {
        return Trade.builder()
                .id("T-" + positionId)
                .positionId(positionId)
                .symbol(symbol)
                .side(OrderSide.BUY)
                .entryPrice(new BigDecimal("100"))
                .exitPrice(new BigDecimal("101"))
                .quantity(new BigDecimal("5"))
                .positionSize(new BigDecimal("100"))
                .leverage(new BigDecimal("5"))
                .fees(new BigDecimal("0.5"))
                .realizedPnl(new BigDecimal(pnl))
                .openedAt(clock.instant())
                .closedAt(clock.instant())
                .exitReason(ExitReason.TAKE_PROFIT)
                .build();
    }

    private TradeIntent intent(String symbol) {
        return TradeIntent.builder()
                .symbol(symbol)
                .direction(Direction.BUY)
                .aggregateConfidence(0.8)
                .contributingSignalCount(4)
                .timestamp(clock.instant())
                .build();
    }
}
