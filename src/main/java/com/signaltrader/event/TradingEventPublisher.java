package com.signaltrader.event;

import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for {@link TradingEvent}s.
 * Delivery is synchronous unless the listener is {@code @Async}.
 */
@Component
public class TradingEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public TradingEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishTradeOpened(Object source, Position position) {
        String message = String.format(
                "Opened %s %s qty=%s @ %s (lev %sx, SL %s, TP %s, liq %s)",
                position.getSide(),
                position.getSymbol(),
                position.getQuantity().toPlainString(),
                position.getEntryPrice().toPlainString(),
                position.getLeverage().toPlainString(),
                position.getStopLossPrice().toPlainString(),
                position.getTakeProfitPrice().toPlainString(),
                position.getLiquidationPrice().toPlainString());
        publish(new TradingEvent(
                source, TradingEventType.TRADE_OPENED, position.getSymbol(), message, position, null, null));
    }

    public void publishTradeClosed(Object source, Trade trade) {
        String message = String.format(
                "Closed %s %s @ %s (%s): pnl %s",
                trade.getSide(),
                trade.getSymbol(),
                trade.getExitPrice().toPlainString(),
                trade.getExitReason(),
                trade.getRealizedPnl().toPlainString());
        publish(new TradingEvent(source, TradingEventType.TRADE_CLOSED, trade.getSymbol(), message, null, trade, null));
    }

    public void publishCircuitBreakerTripped(Object source, CircuitBreakerState state, String reason) {
        publish(new TradingEvent(
                source,
                TradingEventType.CIRCUIT_BREAKER_TRIPPED,
                null,
                "Circuit breaker " + state + ": " + reason,
                null,
                null,
                Map.of("state", state.name())));
    }

    public void publishCircuitBreakerReset(Object source, String operator) {
        publish(new TradingEvent(
                source,
                TradingEventType.CIRCUIT_BREAKER_RESET,
                null,
                "Circuit breaker reset by " + operator,
                null,
                null,
                Map.of("operator", operator)));
    }

    public void publishExecutionError(Object source, String symbol, String clientOrderId, String message) {
        Map<String, Object> details = new HashMap<>();
        if (clientOrderId != null) {
            details.put("clientOrderId", clientOrderId);
        }
        publish(new TradingEvent(source, TradingEventType.EXECUTION_ERROR, symbol, message, null, null, details));
    }

    public void publishEmergencyStop(Object source, String reason, boolean closePositions) {
        publish(new TradingEvent(
                source,
                TradingEventType.EMERGENCY_STOP,
                null,
                "Emergency stop: " + reason,
                null,
                null,
                Map.of("closePositions", closePositions)));
    }

    private void publish(TradingEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
