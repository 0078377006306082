package com.signaltrader.risk;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.event.TradingEventPublisher;
import com.signaltrader.exception.BusinessException;
import com.signaltrader.exception.ErrorCode;
import com.signaltrader.exception.LedgerWriteException;
import com.signaltrader.ledger.AccountStateService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Account-level trading halt.
 *
 * <p>States:
 * <ul>
 *   <li><b>TRIPPED_DAILY:</b> realized PnL for the trading day is at or below
 *       {@code -dailyLossLimit * equityAtDayStart}. Re-arms on its own at the next trading day.</li>
 *   <li><b>TRIPPED_STREAK:</b> consecutive losing trades reached {@code maxConsecutiveLosses}.
 *       Stays latched until an operator reset.</li>
 *   <li><b>TRIPPED_MANUAL:</b> emergency stop. Stays latched until an operator reset.</li>
 * </ul>
 *
 * <p>Every trip and reset is written to the ledger through {@link AccountStateService}, so a
 * restart comes back in the same state. A trip whose ledger write fails is still reported as
 * tripped; the next evaluation sees the same counters and writes it again.
 *
 * <p>Evaluation is serialized so that concurrent cycles on different symbols record one trip.
 */
@Service
public class TradingCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(TradingCircuitBreaker.class);

    private final AccountStateService accountStateService;
    private final TradingProperties tradingProperties;
    private final TradingEventPublisher tradingEventPublisher;
    private final Clock clock;

    /** Set first on emergency stop, before anything is written or closed. */
    private final AtomicBoolean emergencyStop = new AtomicBoolean(false);

    public TradingCircuitBreaker(
            AccountStateService accountStateService,
            TradingProperties tradingProperties,
            TradingEventPublisher tradingEventPublisher,
            Clock clock) {
        this.accountStateService = accountStateService;
        this.tradingProperties = tradingProperties;
        this.tradingEventPublisher = tradingEventPublisher;
        this.clock = clock;
    }

    // ========================
    // EVALUATION
    // ========================

    public CircuitBreakerState evaluate() {
        return evaluate(accountStateService.current());
    }

    /**
     * Returns the breaker state for {@code account}, tripping the breaker when a
     * limit is breached. Never throws on a failed ledger write.
     */
    public synchronized CircuitBreakerState evaluate(AccountState account) {
        if (emergencyStop.get()) {
            return CircuitBreakerState.TRIPPED_MANUAL;
        }

        LocalDate today = LocalDate.now(clock);
        AccountState state = account.rollTo(today);

        CircuitBreakerState latched = state.activeLatch(today);
        if (latched != null) {
            return latched;
        }

        if (isDailyLossBreached(state)) {
            return trip(
                    CircuitBreakerState.TRIPPED_DAILY,
                    String.format(
                            "daily realized pnl %s breached limit -%s",
                            state.getDailyRealizedPnl().toPlainString(),
                            dailyLossLimitAmount(state).toPlainString()));
        }

        int maxLosses = tradingProperties.getCircuitBreaker().getMaxConsecutiveLosses();
        if (state.getConsecutiveLosses() >= maxLosses) {
            return trip(
                    CircuitBreakerState.TRIPPED_STREAK,
                    state.getConsecutiveLosses() + " consecutive losing trades (limit " + maxLosses + ")");
        }

        return CircuitBreakerState.ARMED;
    }

    /** Latched state without evaluating limits or writing anything. */
    public CircuitBreakerState currentState() {
        if (emergencyStop.get()) {
            return CircuitBreakerState.TRIPPED_MANUAL;
        }
        CircuitBreakerState latched = accountStateService.current().activeLatch(LocalDate.now(clock));
        return latched != null ? latched : CircuitBreakerState.ARMED;
    }

    public boolean isTripped() {
        return evaluate().isTripped();
    }

    /** True while an emergency stop is in force; new entries and order retries must stop. */
    public boolean isHalted() {
        return emergencyStop.get();
    }

    // ========================
    // MANUAL CONTROL
    // ========================

    /**
     * Latches TRIPPED_MANUAL. The in-memory halt flag is set before the ledger write, so
     * a failing ledger never delays the stop.
     */
    public synchronized void tripManual(String reason) {
        emergencyStop.set(true);
        log.error("Circuit breaker TRIPPED_MANUAL: {}", reason);
        try {
            accountStateService.recordBreakerTrip(CircuitBreakerState.TRIPPED_MANUAL, reason);
        } catch (LedgerWriteException e) {
            log.error("Failed to record manual trip, halt remains in force in memory: {}", e.getMessage());
        }
        tradingEventPublisher.publishCircuitBreakerTripped(this, CircuitBreakerState.TRIPPED_MANUAL, reason);
    }

    /**
     * Re-arms the breaker. Refused while today's loss is still beyond the daily limit,
     * since the breaker would trip again on the next evaluation.
     *
     * @throws BusinessException with CONFLICT when the daily loss limit is still breached
     */
    public synchronized CircuitBreakerState reset(String operator) {
        LocalDate today = LocalDate.now(clock);
        AccountState state = accountStateService.current();
        if (isDailyLossBreached(state) || state.activeLatch(today) == CircuitBreakerState.TRIPPED_DAILY) {
            throw new BusinessException(
                    ErrorCode.CONFLICT,
                    "Daily loss limit still breached for " + state.getTradingDay()
                            + "; breaker re-arms at the next trading day");
        }

        accountStateService.recordBreakerReset(operator);
        emergencyStop.set(false);
        log.info("Circuit breaker reset by {}", operator);
        tradingEventPublisher.publishCircuitBreakerReset(this, operator);
        return evaluate();
    }

    /** Re-applies a manual latch found in the ledger after a restart. */
    public void restore(AccountState account) {
        CircuitBreakerState latched = account.activeLatch(LocalDate.now(clock));
        if (latched == CircuitBreakerState.TRIPPED_MANUAL) {
            emergencyStop.set(true);
        }
        log.info("Circuit breaker restored: {}", latched != null ? latched : evaluate(account));
    }

    public CircuitBreakerStatus status() {
        AccountState state = accountStateService.current();
        return CircuitBreakerStatus.builder()
                .state(evaluate(state))
                .tradingDay(state.getTradingDay())
                .dailyRealizedPnl(state.getDailyRealizedPnl())
                .dailyLossLimitAmount(dailyLossLimitAmount(state))
                .consecutiveLosses(state.getConsecutiveLosses())
                .maxConsecutiveLosses(tradingProperties.getCircuitBreaker().getMaxConsecutiveLosses())
                .emergencyStopActive(emergencyStop.get())
                .build();
    }

    // ========================
    // INTERNALS
    // ========================

    private CircuitBreakerState trip(CircuitBreakerState tripState, String reason) {
        LocalDate today = LocalDate.now(clock);
        if (accountStateService.current().activeLatch(today) == tripState) {
            return tripState;
        }

        log.error("Circuit breaker {}: {}", tripState, reason);
        try {
            accountStateService.recordBreakerTrip(tripState, reason);
        } catch (LedgerWriteException e) {
            log.error("Failed to record {} trip, will retry on next evaluation: {}", tripState, e.getMessage());
        }
        tradingEventPublisher.publishCircuitBreakerTripped(this, tripState, reason);
        return tripState;
    }

    private boolean isDailyLossBreached(AccountState state) {
        BigDecimal dailyPnl = state.getDailyRealizedPnl();
        return dailyPnl.signum() < 0 && dailyPnl.compareTo(dailyLossLimitAmount(state).negate()) <= 0;
    }

    private BigDecimal dailyLossLimitAmount(AccountState state) {
        return state.getEquityAtDayStart()
                .multiply(BigDecimal.valueOf(tradingProperties.getCircuitBreaker().getDailyLossLimit()))
                .setScale(8, RoundingMode.HALF_UP);
    }
}
