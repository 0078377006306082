package com.signaltrader.notification;

import com.signaltrader.domain.enums.AlertSeverity;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.event.TradingEvent;
import com.signaltrader.event.TradingEventType;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns {@link TradingEvent}s into operator alerts and sends them to Telegram.
 *
 * <p>Delivery is asynchronous via {@code @Async("eventExecutor")}; a slow or failing
 * Telegram call never delays the trading thread that published the event.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final TelegramNotifier telegramNotifier;
    private final NotificationTemplateEngine notificationTemplateEngine;
    private final TelegramConfig telegramConfig;
    private final Clock clock;

    public NotificationService(
            TelegramNotifier telegramNotifier,
            NotificationTemplateEngine notificationTemplateEngine,
            TelegramConfig telegramConfig,
            Clock clock) {
        this.telegramNotifier = telegramNotifier;
        this.notificationTemplateEngine = notificationTemplateEngine;
        this.telegramConfig = telegramConfig;
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onTradingEvent(TradingEvent event) {
        Alert alert = Alert.builder()
                .type(event.getEventType())
                .severity(severityOf(event))
                .title(event.getEventType().name())
                .message(event.getMessage())
                .timestamp(clock.instant())
                .build();
        notify(alert);
    }

    public void notify(Alert alert) {
        // AlertSeverity is ordered CRITICAL, WARNING, INFO
        if (alert.getSeverity().ordinal() > telegramConfig.getMinSeverity().ordinal()) {
            log.debug("Alert {} below minimum severity, not sent", alert.getTitle());
            return;
        }
        try {
            telegramNotifier.send(notificationTemplateEngine.render(alert), alert.getSeverity());
        } catch (RuntimeException e) {
            log.error("Failed to send notification {}: {}", alert.getTitle(), e.getMessage());
        }
    }

    static AlertSeverity severityOf(TradingEvent event) {
        TradingEventType type = event.getEventType();
        return switch (type) {
            case CIRCUIT_BREAKER_TRIPPED, EMERGENCY_STOP -> AlertSeverity.CRITICAL;
            case EXECUTION_ERROR -> AlertSeverity.WARNING;
            case TRADE_CLOSED -> closedSeverity(event);
            case TRADE_OPENED, CIRCUIT_BREAKER_RESET -> AlertSeverity.INFO;
        };
    }

    private static AlertSeverity closedSeverity(TradingEvent event) {
        if (event.getTrade() == null) {
            return AlertSeverity.INFO;
        }
        ExitReason reason = event.getTrade().getExitReason();
        if (reason == ExitReason.LIQUIDATION) {
            return AlertSeverity.CRITICAL;
        }
        return reason == ExitReason.STOP_LOSS ? AlertSeverity.WARNING : AlertSeverity.INFO;
    }
}
