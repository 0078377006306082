package com.signaltrader.engine;

import com.signaltrader.consensus.ConsensusAggregator;
import com.signaltrader.consensus.ConsensusResult;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.ExecutionResult;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Signal;
import com.signaltrader.domain.model.SymbolStats;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.domain.model.TradeIntent;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exception.LedgerWriteException;
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
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One pass of the decision pipeline for one symbol:
 *
 * <pre>
 * market context -> exit check -> signals -> consensus -> position check
 *     -> risk (circuit breaker gate first) -> execution -> position
 * </pre>
 *
 * <p>An open position in the intent's direction ends the cycle. One in the opposite
 * direction is closed with SIGNAL_REVERSAL first and the new intent then goes through risk
 * as usual. Rejections are written to the ledger.
 *
 * <p>Cycles of different symbols share one account. Risk evaluation and the margin
 * reservation of an approved intent happen under a single account-wide lock, and the
 * reservation is held until the execution has finished, so overlapping entries on
 * different symbols cannot commit the same margin twice.
 */
@Service
public class DecisionCycleService {

    private static final Logger log = LoggerFactory.getLogger(DecisionCycleService.class);

    private final MarketContextService marketContextService;
    private final SignalCollector signalCollector;
    private final ConsensusAggregator consensusAggregator;
    private final SymbolStatsService symbolStatsService;
    private final RiskManager riskManager;
    private final TradingCircuitBreaker circuitBreaker;
    private final OrderExecutionEngine orderExecutionEngine;
    private final PositionLifecycleManager positionLifecycleManager;
    private final AccountStateService accountStateService;
    private final TradingMetrics tradingMetrics;

    private final ReentrantLock entryLock = new ReentrantLock();

    public DecisionCycleService(
            MarketContextService marketContextService,
            SignalCollector signalCollector,
            ConsensusAggregator consensusAggregator,
            SymbolStatsService symbolStatsService,
            RiskManager riskManager,
            TradingCircuitBreaker circuitBreaker,
            OrderExecutionEngine orderExecutionEngine,
            PositionLifecycleManager positionLifecycleManager,
            AccountStateService accountStateService,
            TradingMetrics tradingMetrics) {
        this.marketContextService = marketContextService;
        this.signalCollector = signalCollector;
        this.consensusAggregator = consensusAggregator;
        this.symbolStatsService = symbolStatsService;
        this.riskManager = riskManager;
        this.circuitBreaker = circuitBreaker;
        this.orderExecutionEngine = orderExecutionEngine;
        this.positionLifecycleManager = positionLifecycleManager;
        this.accountStateService = accountStateService;
        this.tradingMetrics = tradingMetrics;
    }

    public CycleResult runCycle(String symbol) {
        long startNanos = System.nanoTime();
        try {
            return doRunCycle(symbol);
        } finally {
            tradingMetrics.recordCycle(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private CycleResult doRunCycle(String symbol) {
        MarketContext context;
        try {
            context = marketContextService.build(symbol);
        } catch (ExchangeException e) {
            log.warn("Skipping cycle for {}: market data unavailable: {}", symbol, e.getMessage());
            return skipped(symbol, "market data unavailable: " + e.getMessage());
        }

        // Exit check on the fresh price before deciding anything new
        Trade exitTrade = checkExit(symbol, context).orElse(null);
        if (circuitBreaker.isHalted()) {
            return result(symbol, CycleOutcome.SKIPPED, null, exitTrade, "emergency stop active");
        }

        List<Signal> signals = signalCollector.collect(symbol, context);
        ConsensusResult consensus = consensusAggregator.aggregate(symbol, signals);

        if (consensus.isHold()) {
            tradingMetrics.recordHold(consensus.getHoldReason());
            return CycleResult.builder()
                    .symbol(symbol)
                    .outcome(CycleOutcome.HOLD)
                    .consensus(consensus)
                    .closedTrade(exitTrade)
                    .build();
        }

        TradeIntent intent = consensus.getIntent();
        tradingMetrics.recordIntent(intent.getDirection());

        Optional<Position> existing = positionLifecycleManager.findOpenPosition(symbol);
        if (existing.isPresent()) {
            Position position = existing.get();
            if (position.getSide() == intent.getDirection().toOrderSide()) {
                log.info("Already {} on {} (position {}), no new entry", position.getSide(), symbol, position.getId());
                return result(
                        symbol, CycleOutcome.ALREADY_POSITIONED, consensus, exitTrade, "position " + position.getId());
            }
            log.info("Signal reversal on {}: closing {} position {}", symbol, position.getSide(), position.getId());
            Optional<Trade> reversal =
                    positionLifecycleManager.closePosition(position.getId(), ExitReason.SIGNAL_REVERSAL);
            if (reversal.isEmpty()) {
                return result(
                        symbol,
                        CycleOutcome.ALREADY_POSITIONED,
                        consensus,
                        exitTrade,
                        "reversal close of " + position.getId() + " did not complete");
            }
            exitTrade = reversal.get();
        }

        if (orderExecutionEngine.isInFlight(symbol)) {
            return skipped(symbol, "entry order already in flight");
        }

        SymbolStats stats = symbolStatsService.stats(context);
        String reservationId = "entry-" + UUID.randomUUID();
        RiskDecision decision;
        entryLock.lock();
        try {
            AccountState account = accountStateService.currentWithReservations();
            decision = riskManager.evaluate(intent, account, stats);
            if (!decision.isRejected()) {
                accountStateService.reserveMargin(reservationId, symbol, decision.getPositionSize());
            }
        } finally {
            entryLock.unlock();
        }

        if (decision.isRejected()) {
            tradingMetrics.recordRejection(decision.getRejectionReason());
            try {
                accountStateService.recordRejection(
                        intent, decision.getRejectionReason(), decision.getRejectionDetail());
            } catch (LedgerWriteException e) {
                log.error("Failed to record rejection for {}: {}", symbol, e.getMessage());
            }
            return CycleResult.builder()
                    .symbol(symbol)
                    .outcome(CycleOutcome.REJECTED)
                    .consensus(consensus)
                    .rejectionReason(decision.getRejectionReason())
                    .closedTrade(exitTrade)
                    .detail(decision.getRejectionDetail())
                    .build();
        }

        try {
            ExecutionResult execution = orderExecutionEngine.execute(decision);
            return CycleResult.builder()
                    .symbol(symbol)
                    .outcome(CycleOutcome.EXECUTED)
                    .consensus(consensus)
                    .execution(execution)
                    .closedTrade(exitTrade)
                    .build();
        } catch (OrderExecutionException e) {
            tradingMetrics.recordRejection(e.getRejectionReason());
            return CycleResult.builder()
                    .symbol(symbol)
                    .outcome(CycleOutcome.EXECUTION_FAILED)
                    .consensus(consensus)
                    .rejectionReason(e.getRejectionReason())
                    .closedTrade(exitTrade)
                    .detail(e.getMessage())
                    .build();
        } finally {
            accountStateService.releaseMargin(reservationId);
        }
    }

    private Optional<Trade> checkExit(String symbol, MarketContext context) {
        if (context.getLastPrice() == null || context.getLastPrice().signum() <= 0) {
            return Optional.empty();
        }
        return positionLifecycleManager
                .findOpenPosition(symbol)
                .flatMap(position -> positionLifecycleManager.evaluateExit(position.getId(), context.getLastPrice()));
    }

    private static CycleResult skipped(String symbol, String detail) {
        return CycleResult.builder()
                .symbol(symbol)
                .outcome(CycleOutcome.SKIPPED)
                .detail(detail)
                .build();
    }

    private static CycleResult result(
            String symbol, CycleOutcome outcome, ConsensusResult consensus, Trade closedTrade, String detail) {
        return CycleResult.builder()
                .symbol(symbol)
                .outcome(outcome)
                .consensus(consensus)
                .closedTrade(closedTrade)
                .detail(detail)
                .build();
    }
}
