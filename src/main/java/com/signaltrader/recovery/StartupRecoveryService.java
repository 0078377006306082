package com.signaltrader.recovery;

import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.Position;
import com.signaltrader.engine.TradingCycleScheduler;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exchange.AccountSnapshot;
import com.signaltrader.exchange.ExchangeAdapter;
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.ledger.TradeLedger;
import com.signaltrader.position.PositionLifecycleManager;
import com.signaltrader.risk.TradingCircuitBreaker;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Rebuilds runtime state from the trade ledger once the application is ready.
 * <ol>
 *   <li>Replay the ledger into the live account state</li>
 *   <li>Re-register open positions with the position lifecycle manager</li>
 *   <li>Re-derive the circuit breaker state, including a latched manual stop</li>
 *   <li>Compare ledger equity with the exchange balance (warning only)</li>
 *   <li>Start the decision cycles</li>
 * </ol>
 *
 * <p>If any of steps 1 to 3 fails, decision cycles are not started: trading on a state
 * that could not be reconstructed is never allowed.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    /** Relative difference between ledger and exchange equity that is logged as a warning. */
    private static final BigDecimal BALANCE_WARN_TOLERANCE = new BigDecimal("0.01");

    private final AccountStateService accountStateService;
    private final TradeLedger tradeLedger;
    private final PositionLifecycleManager positionLifecycleManager;
    private final TradingCircuitBreaker circuitBreaker;
    private final ExchangeAdapter exchangeAdapter;
    private final TradingCycleScheduler tradingCycleScheduler;

    public StartupRecoveryService(
            AccountStateService accountStateService,
            TradeLedger tradeLedger,
            PositionLifecycleManager positionLifecycleManager,
            TradingCircuitBreaker circuitBreaker,
            ExchangeAdapter exchangeAdapter,
            TradingCycleScheduler tradingCycleScheduler) {
        this.accountStateService = accountStateService;
        this.tradeLedger = tradeLedger;
        this.positionLifecycleManager = positionLifecycleManager;
        this.circuitBreaker = circuitBreaker;
        this.exchangeAdapter = exchangeAdapter;
        this.tradingCycleScheduler = tradingCycleScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting recovery from trade ledger...");
        RecoveryResult result =
                RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            // Step 1: Ledger replay
            AccountState state = accountStateService.reload();
            result.setLastSequenceId(state.getLastSequenceId());
            result.setEquity(state.getEquity());
            result.setDailyRealizedPnl(state.getDailyRealizedPnl());
            result.setConsecutiveLosses(state.getConsecutiveLosses());

            // Step 2: Open positions
            List<Position> openPositions = tradeLedger.openPositions();
            positionLifecycleManager.restore(openPositions);
            result.setOpenPositionsRestored(openPositions.size());

            // Step 3: Circuit breaker
            circuitBreaker.restore(state);
            CircuitBreakerState breakerState = circuitBreaker.evaluate();
            result.setBreakerState(breakerState);
            if (breakerState.isTripped()) {
                log.warn("Circuit breaker is {} after recovery; new entries blocked until it re-arms", breakerState);
            }

            // Step 4: Exchange balance
            checkExchangeBalance(state, result);

            // Step 5: Cycles
            tradingCycleScheduler.start();
            result.setCyclesStarted(tradingCycleScheduler.isRunning());
            result.setSuccess(true);
        } catch (Exception e) {
            result.setSuccess(false);
            result.setError(e.getMessage());
            log.error("Recovery failed, decision cycles NOT started", e);
        }

        result.setDurationMs(System.currentTimeMillis() - result.getStartedAt());
        log.info(
                "Recovery {}: duration={}ms, seq={}, equity={}, dailyPnl={}, losses={}, openPositions={}, breaker={}",
                result.isSuccess() ? "completed" : "failed",
                result.getDurationMs(),
                result.getLastSequenceId(),
                result.getEquity(),
                result.getDailyRealizedPnl(),
                result.getConsecutiveLosses(),
                result.getOpenPositionsRestored(),
                result.getBreakerState());
        return result;
    }

    private void checkExchangeBalance(AccountState state, RecoveryResult result) {
        try {
            AccountSnapshot snapshot = exchangeAdapter.getBalance();
            result.setExchangeEquity(snapshot.getTotalEquity());
            result.setExchangeBalanceChecked(true);

            BigDecimal ledgerEquity = state.getEquity();
            if (ledgerEquity.signum() > 0) {
                BigDecimal drift = snapshot.getTotalEquity()
                        .subtract(ledgerEquity)
                        .abs()
                        .divide(ledgerEquity, 8, RoundingMode.HALF_UP);
                if (drift.compareTo(BALANCE_WARN_TOLERANCE) > 0) {
                    log.warn(
                            "Exchange equity {} differs from ledger equity {} by {}",
                            snapshot.getTotalEquity(),
                            ledgerEquity,
                            drift);
                }
            }
        } catch (ExchangeException e) {
            log.warn("Exchange balance check skipped: {}", e.getMessage());
        }
    }
}
