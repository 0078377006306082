package com.signaltrader.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signaltrader.consensus.ConsensusAggregator;
import com.signaltrader.consensus.ConsensusResult;
import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.enums.HoldReason;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.PositionStatus;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.ExecutionResult;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.SymbolStats;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.domain.model.TradeIntent;
import com.signaltrader.engine.CycleOutcome;
import com.signaltrader.engine.CycleResult;
import com.signaltrader.engine.DecisionCycleService;
import com.signaltrader.exception.ExchangeErrorType;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exception.OrderExecutionException;
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.market.MarketContextService;
import com.signaltrader.market.SymbolStatsService;
import com.signaltrader.observability.TradingMetrics;
import com.signaltrader.oms.OrderExecutionEngine;
import com.signaltrader.position.PositionLifecycleManager;
import com.signaltrader.risk.RiskDecision;
import com.signaltrader.risk.RiskManager;
import com.signaltrader.risk.TradingCircuitBreaker;
import com.signaltrader.signal.SignalCollector;
import com.signaltrader.testsupport.MarketFixtures;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for DecisionCycleService: the order of pipeline stages and every way a cycle ends.
 */
@ExtendWith(MockitoExtension.class)
class DecisionCycleServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T10:00:00Z");

    @Mock
    private MarketContextService marketContextService;

    @Mock
    private SignalCollector signalCollector;

    @Mock
    private ConsensusAggregator consensusAggregator;

    @Mock
    private SymbolStatsService symbolStatsService;

    @Mock
    private RiskManager riskManager;

    @Mock
    private TradingCircuitBreaker circuitBreaker;

    @Mock
    private OrderExecutionEngine orderExecutionEngine;

    @Mock
    private PositionLifecycleManager positionLifecycleManager;

    @Mock
    private AccountStateService accountStateService;

    @Mock
    private TradingMetrics tradingMetrics;

    private DecisionCycleService decisionCycleService;
    private MarketContext context;

    @BeforeEach
    void setUp() {
        decisionCycleService = new DecisionCycleService(
                marketContextService,
                signalCollector,
                consensusAggregator,
                symbolStatsService,
                riskManager,
                circuitBreaker,
                orderExecutionEngine,
                positionLifecycleManager,
                accountStateService,
                tradingMetrics);
        context = MarketFixtures.context("BTCUSDT", 99, 100);
        lenient().when(marketContextService.build("BTCUSDT")).thenReturn(context);
        lenient().when(positionLifecycleManager.findOpenPosition("BTCUSDT")).thenReturn(Optional.empty());
        lenient().when(signalCollector.collect(eq("BTCUSDT"), any(MarketContext.class))).thenReturn(List.of());
        lenient()
                .when(accountStateService.currentWithReservations())
                .thenReturn(AccountState.initial(new BigDecimal("1000"), LocalDate.of(2025, 3, 10)));
        lenient().when(symbolStatsService.stats(context)).thenReturn(SymbolStats.builder().symbol("BTCUSDT").build());
    }

    @Test
    @DisplayName("No market data skips the cycle")
    void marketDataUnavailable() {
        when(marketContextService.build("BTCUSDT"))
                .thenThrow(new ExchangeException(ExchangeErrorType.TRANSIENT, "timeout"));

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.SKIPPED);
        verify(signalCollector, never()).collect(anyString(), any());
        verify(tradingMetrics).recordCycle(any());
    }

    @Test
    @DisplayName("An emergency stop skips signal collection")
    void haltedSkips() {
        when(circuitBreaker.isHalted()).thenReturn(true);

        assertThat(decisionCycleService.runCycle("BTCUSDT").getOutcome()).isEqualTo(CycleOutcome.SKIPPED);
        verify(signalCollector, never()).collect(anyString(), any());
    }

    @Test
    @DisplayName("A hold ends the cycle before risk")
    void holdEndsCycle() {
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList()))
                .thenReturn(ConsensusResult.hold("BTCUSDT", HoldReason.BELOW_THRESHOLD, 0.2, 4, 5));

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.HOLD);
        verify(tradingMetrics).recordHold(HoldReason.BELOW_THRESHOLD);
        verify(riskManager, never()).evaluate(any(), any(), any());
    }

    @Test
    @DisplayName("An approved intent is executed")
    void approvedIsExecuted() {
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList())).thenReturn(buyConsensus());
        RiskDecision decision = RiskDecision.builder().symbol("BTCUSDT").rejected(false).build();
        when(riskManager.evaluate(any(TradeIntent.class), any(AccountState.class), any(SymbolStats.class)))
                .thenReturn(decision);
        ExecutionResult execution = ExecutionResult.builder().success(true).positionId("P-1").build();
        when(orderExecutionEngine.execute(decision)).thenReturn(execution);

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.EXECUTED);
        assertThat(result.getExecution()).isSameAs(execution);
        verify(tradingMetrics).recordIntent(Direction.BUY);
    }

    @Test
    @DisplayName("An approved intent holds a margin reservation until execution returns")
    void approvedIntentReservesMargin() {
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList())).thenReturn(buyConsensus());
        RiskDecision decision = RiskDecision.builder()
                .symbol("BTCUSDT")
                .positionSize(new BigDecimal("120"))
                .rejected(false)
                .build();
        when(riskManager.evaluate(any(TradeIntent.class), any(AccountState.class), any(SymbolStats.class)))
                .thenReturn(decision);
        when(orderExecutionEngine.execute(decision))
                .thenThrow(new OrderExecutionException("BTCUSDT", "st-btcu-1", "rejected by exchange"));

        decisionCycleService.runCycle("BTCUSDT");

        ArgumentCaptor<String> reservationId = ArgumentCaptor.forClass(String.class);
        InOrder inOrder = inOrder(accountStateService, orderExecutionEngine);
        inOrder.verify(accountStateService).currentWithReservations();
        inOrder.verify(accountStateService)
                .reserveMargin(reservationId.capture(), eq("BTCUSDT"), eq(new BigDecimal("120")));
        inOrder.verify(orderExecutionEngine).execute(decision);
        inOrder.verify(accountStateService).releaseMargin(reservationId.getValue());
    }

    @Test
    @DisplayName("A rejected intent is written to the ledger")
    void rejectionRecorded() {
        TradeIntent intent = buyConsensus().getIntent();
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList())).thenReturn(buyConsensus());
        when(riskManager.evaluate(any(TradeIntent.class), any(AccountState.class), any(SymbolStats.class)))
                .thenReturn(RiskDecision.rejected(intent, RejectionReason.INSUFFICIENT_MARGIN, "no margin"));

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.REJECTED);
        assertThat(result.getRejectionReason()).isEqualTo(RejectionReason.INSUFFICIENT_MARGIN);
        verify(accountStateService)
                .recordRejection(any(TradeIntent.class), eq(RejectionReason.INSUFFICIENT_MARGIN), anyString());
        verify(orderExecutionEngine, never()).execute(any());
        verify(accountStateService, never()).reserveMargin(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("A failed execution ends the cycle as execution_failed")
    void executionFailure() {
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList())).thenReturn(buyConsensus());
        RiskDecision decision = RiskDecision.builder().symbol("BTCUSDT").rejected(false).build();
        when(riskManager.evaluate(any(TradeIntent.class), any(AccountState.class), any(SymbolStats.class)))
                .thenReturn(decision);
        when(orderExecutionEngine.execute(decision))
                .thenThrow(new OrderExecutionException("BTCUSDT", "st-btcu-1", "rejected by exchange"));

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.EXECUTION_FAILED);
        assertThat(result.getRejectionReason()).isEqualTo(RejectionReason.EXECUTION_FAILED);
        verify(tradingMetrics).recordRejection(RejectionReason.EXECUTION_FAILED);
    }

    @Test
    @DisplayName("A position in the same direction blocks a new entry")
    void alreadyPositioned() {
        when(positionLifecycleManager.findOpenPosition("BTCUSDT")).thenReturn(Optional.of(position(OrderSide.BUY)));
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList())).thenReturn(buyConsensus());

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.ALREADY_POSITIONED);
        verify(riskManager, never()).evaluate(any(), any(), any());
    }

    @Test
    @DisplayName("An opposite position is closed by signal reversal before the new entry")
    void reversalClosesFirst() {
        Position shortPosition = position(OrderSide.SELL);
        when(positionLifecycleManager.findOpenPosition("BTCUSDT")).thenReturn(Optional.of(shortPosition));
        Trade reversal = Trade.builder().positionId("P-1").exitReason(ExitReason.SIGNAL_REVERSAL).build();
        when(positionLifecycleManager.closePosition("P-1", ExitReason.SIGNAL_REVERSAL))
                .thenReturn(Optional.of(reversal));
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList())).thenReturn(buyConsensus());
        RiskDecision decision = RiskDecision.builder().symbol("BTCUSDT").rejected(false).build();
        when(riskManager.evaluate(any(TradeIntent.class), any(AccountState.class), any(SymbolStats.class)))
                .thenReturn(decision);
        when(orderExecutionEngine.execute(decision)).thenReturn(ExecutionResult.builder().success(true).build());

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.EXECUTED);
        assertThat(result.getClosedTrade()).isSameAs(reversal);
    }

    @Test
    @DisplayName("The exit check runs on the fresh price before signals")
    void exitCheckFirst() {
        when(positionLifecycleManager.findOpenPosition("BTCUSDT"))
                .thenReturn(Optional.of(position(OrderSide.BUY)))
                .thenReturn(Optional.empty());
        Trade stopLoss = Trade.builder().positionId("P-1").exitReason(ExitReason.STOP_LOSS).build();
        when(positionLifecycleManager.evaluateExit("P-1", context.getLastPrice())).thenReturn(Optional.of(stopLoss));
        when(consensusAggregator.aggregate(eq("BTCUSDT"), anyList()))
                .thenReturn(ConsensusResult.hold("BTCUSDT", HoldReason.INSUFFICIENT_QUORUM, 0.0, 1, 5));

        CycleResult result = decisionCycleService.runCycle("BTCUSDT");

        assertThat(result.getOutcome()).isEqualTo(CycleOutcome.HOLD);
        assertThat(result.getClosedTrade()).isSameAs(stopLoss);
    }

    private static ConsensusResult buyConsensus() {
        TradeIntent intent = TradeIntent.builder()
                .symbol("BTCUSDT")
                .direction(Direction.BUY)
                .aggregateConfidence(0.8)
                .contributingSignalCount(4)
                .timestamp(NOW)
                .build();
        return ConsensusResult.trade(intent, 0.8, 4, 5);
    }

    private static Position position(OrderSide side) {
        return Position.builder()
                .id("P-1")
                .symbol("BTCUSDT")
                .side(side)
                .status(PositionStatus.OPEN)
                .openedAt(NOW)
                .build();
    }
}
