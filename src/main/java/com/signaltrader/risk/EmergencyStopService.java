package com.signaltrader.risk;

import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.event.TradingEventPublisher;
import com.signaltrader.position.PositionLifecycleManager;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator emergency stop.
 *
 * <p>Execution order:
 * <ol>
 *   <li>Trip the circuit breaker to TRIPPED_MANUAL. The halt flag is set before anything
 *       else, so pending order retries stop at their next attempt</li>
 *   <li>Publish EMERGENCY_STOP</li>
 *   <li>Optionally close all open positions at market, in parallel, with exit reason MANUAL</li>
 * </ol>
 *
 * <p>Failures on individual positions do not abort the others; they are reported in the
 * {@link EmergencyStopResult}. Trading resumes only through {@link #deactivate(String)}.
 */
@Service
public class EmergencyStopService {

    private static final Logger log = LoggerFactory.getLogger(EmergencyStopService.class);

    private static final long CLOSE_TIMEOUT_SECONDS = 30;

    private final TradingCircuitBreaker circuitBreaker;
    private final PositionLifecycleManager positionLifecycleManager;
    private final TradingEventPublisher tradingEventPublisher;
    private final Clock clock;

    public EmergencyStopService(
            TradingCircuitBreaker circuitBreaker,
            PositionLifecycleManager positionLifecycleManager,
            TradingEventPublisher tradingEventPublisher,
            Clock clock) {
        this.circuitBreaker = circuitBreaker;
        this.positionLifecycleManager = positionLifecycleManager;
        this.tradingEventPublisher = tradingEventPublisher;
        this.clock = clock;
    }

    // ========================
    // ACTIVATION
    // ========================

    /**
     * Halts trading and, when {@code closePositions} is set, flattens every open position.
     * A repeated activation without closing is a no-op; with closing it retries the positions
     * still open.
     */
    public EmergencyStopResult activate(String reason, boolean closePositions) {
        boolean wasActive = circuitBreaker.isHalted();
        if (wasActive && !closePositions) {
            log.warn("Emergency stop already active, ignoring duplicate activation");
            return EmergencyStopResult.builder()
                    .success(true)
                    .alreadyActive(true)
                    .reason(reason)
                    .activatedAt(clock.instant())
                    .build();
        }

        log.error("EMERGENCY STOP ACTIVATED: {} (closePositions={})", reason, closePositions);
        if (!wasActive) {
            circuitBreaker.tripManual(reason);
            tradingEventPublisher.publishEmergencyStop(this, reason, closePositions);
        }

        List<String> errors = new ArrayList<>();
        AtomicInteger failed = new AtomicInteger(0);
        int closed = closePositions ? closeAllPositionsParallel(errors, failed) : 0;

        boolean success = errors.isEmpty();
        if (success) {
            log.info("Emergency stop complete: {} position(s) closed", closed);
        } else {
            log.error("Emergency stop completed with {} errors: {}", errors.size(), errors);
        }

        return EmergencyStopResult.builder()
                .success(success)
                .alreadyActive(wasActive)
                .closePositions(closePositions)
                .positionsClosed(closed)
                .positionsFailed(failed.get())
                .reason(reason)
                .activatedAt(clock.instant())
                .errors(errors)
                .build();
    }

    /** Resets the breaker; refused with CONFLICT while the daily loss limit is still breached. */
    public CircuitBreakerState deactivate(String operator) {
        CircuitBreakerState state = circuitBreaker.reset(operator);
        log.info("Emergency stop deactivated by {}, breaker now {}", operator, state);
        return state;
    }

    public boolean isActive() {
        return circuitBreaker.isHalted();
    }

    // ========================
    // PARALLEL POSITION CLOSING
    // ========================

    private int closeAllPositionsParallel(List<String> errors, AtomicInteger failed) {
        List<Position> openPositions = positionLifecycleManager.getOpenPositions();
        if (openPositions.isEmpty()) {
            return 0;
        }

        AtomicInteger closed = new AtomicInteger(0);
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (Position position : openPositions) {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                try {
                    Optional<Trade> trade = positionLifecycleManager.closePosition(position.getId(), ExitReason.MANUAL);
                    if (trade.isPresent()) {
                        closed.incrementAndGet();
                    } else {
                        addError(errors, failed, "Position " + position.getId() + " (" + position.getSymbol()
                                + ") not closed, see previous errors");
                    }
                } catch (Exception e) {
                    addError(errors, failed, "Failed to close position " + position.getId() + " ("
                            + position.getSymbol() + "): " + e.getMessage());
                }
            });
            futures.add(future);
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            log.error("Timeout waiting for position closures", e);
            synchronized (errors) {
                errors.add("Timeout waiting for position closures: " + e.getMessage());
            }
        }

        return closed.get();
    }

    private void addError(List<String> errors, AtomicInteger failed, String error) {
        log.error(error);
        failed.incrementAndGet();
        synchronized (errors) {
            errors.add(error);
        }
    }
}
