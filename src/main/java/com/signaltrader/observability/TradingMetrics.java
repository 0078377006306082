package com.signaltrader.observability;

import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.enums.HoldReason;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.event.TradingEvent;
import com.signaltrader.event.TradingEventType;
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.position.PositionLifecycleManager;
import com.signaltrader.risk.TradingCircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the decision pipeline.
 * <ul>
 *   <li><b>signaltrader.intents</b> (counter, tag direction): trade intents produced by consensus</li>
 *   <li><b>signaltrader.holds</b> (counter, tag reason): cycles that ended in Hold</li>
 *   <li><b>signaltrader.rejections</b> (counter, tag reason): intents refused by risk or execution</li>
 *   <li><b>signaltrader.orders.placed</b> / <b>signaltrader.orders.failed</b> (counters)</li>
 *   <li><b>signaltrader.positions.opened</b> / <b>signaltrader.positions.closed</b>
 *       (counters, closed tagged by exit reason)</li>
 *   <li><b>signaltrader.cycle.duration</b> (timer)</li>
 *   <li><b>signaltrader.equity</b>, <b>signaltrader.positions.open</b>,
 *       <b>signaltrader.circuit_breaker.tripped</b> (gauges, evaluated on scrape)</li>
 * </ul>
 */
@Service
public class TradingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter ordersPlacedCounter;
    private final Counter ordersFailedCounter;
    private final Counter positionsOpenedCounter;
    private final Timer cycleTimer;

    public TradingMetrics(
            MeterRegistry meterRegistry,
            AccountStateService accountStateService,
            PositionLifecycleManager positionLifecycleManager,
            TradingCircuitBreaker circuitBreaker) {
        this.meterRegistry = meterRegistry;

        this.ordersPlacedCounter = Counter.builder("signaltrader.orders.placed")
                .description("Entry orders that filled")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("signaltrader.orders.failed")
                .description("Entry or close orders that failed fatally")
                .register(meterRegistry);
        this.positionsOpenedCounter = Counter.builder("signaltrader.positions.opened")
                .description("Positions opened")
                .register(meterRegistry);
        this.cycleTimer = Timer.builder("signaltrader.cycle.duration")
                .description("Duration of one decision cycle for one symbol")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        meterRegistry.gauge(
                "signaltrader.equity",
                accountStateService,
                service -> service.current().getEquity().doubleValue());
        meterRegistry.gauge(
                "signaltrader.positions.open",
                positionLifecycleManager,
                manager -> manager.getOpenPositions().size());
        meterRegistry.gauge(
                "signaltrader.circuit_breaker.tripped",
                circuitBreaker,
                breaker -> breaker.currentState().isTripped() ? 1.0 : 0.0);
    }

    public void recordIntent(Direction direction) {
        meterRegistry.counter("signaltrader.intents", "direction", direction.name()).increment();
    }

    public void recordHold(HoldReason reason) {
        meterRegistry.counter("signaltrader.holds", "reason", reason.name()).increment();
    }

    public void recordRejection(RejectionReason reason) {
        meterRegistry.counter("signaltrader.rejections", "reason", reason.getCode()).increment();
    }

    public void recordCycle(Duration duration) {
        cycleTimer.record(duration);
    }

    /** Runs after core listeners so counting never delays them. */
    @EventListener
    @Order(20)
    public void onTradingEvent(TradingEvent event) {
        if (event.getEventType() == TradingEventType.TRADE_OPENED) {
            ordersPlacedCounter.increment();
            positionsOpenedCounter.increment();
        } else if (event.getEventType() == TradingEventType.TRADE_CLOSED && event.getTrade() != null) {
            meterRegistry
                    .counter(
                            "signaltrader.positions.closed",
                            "exitReason",
                            event.getTrade().getExitReason().name())
                    .increment();
        } else if (event.getEventType() == TradingEventType.EXECUTION_ERROR) {
            ordersFailedCounter.increment();
        }
    }
}
