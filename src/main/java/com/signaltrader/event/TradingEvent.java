package com.signaltrader.event;

import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever the pipeline does something an operator should hear about.
 *
 * <p>Position is set for TRADE_OPENED, trade for TRADE_CLOSED. The details map carries
 * type-specific values such as the breaker state or the client order id of a failed entry.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService: Telegram alerts</li>
 *   <li>TradingMetrics: trade and error counters</li>
 *   <li>SymbolStatsService: win-rate cache invalidation on TRADE_CLOSED</li>
 * </ul>
 */
public class TradingEvent extends ApplicationEvent {

    private final TradingEventType eventType;
    private final String symbol;
    private final String message;
    private final Position position;
    private final Trade trade;
    private final Map<String, Object> details;

    public TradingEvent(
            Object source,
            TradingEventType eventType,
            String symbol,
            String message,
            Position position,
            Trade trade,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.symbol = symbol;
        this.message = message;
        this.position = position;
        this.trade = trade;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public TradingEventType getEventType() {
        return eventType;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getMessage() {
        return message;
    }

    public Position getPosition() {
        return position;
    }

    public Trade getTrade() {
        return trade;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
