package com.signaltrader.notification;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * Renders alerts as Telegram HTML ({@code <b>bold</b>}), one template per event type.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    public String render(Alert alert) {
        return switch (alert.getType()) {
            case TRADE_OPENED -> renderWithHeader("POSITION OPENED", alert);
            case TRADE_CLOSED -> renderWithHeader("POSITION CLOSED", alert);
            case CIRCUIT_BREAKER_TRIPPED -> String.format(
                    "<b>CIRCUIT BREAKER TRIPPED</b>\n%s\n<b>Action:</b> New entries blocked until re-armed\n"
                            + "<b>Time:</b> %s",
                    alert.getMessage(),
                    TIME_FORMAT.format(alert.getTimestamp()));
            case CIRCUIT_BREAKER_RESET -> renderWithHeader("CIRCUIT BREAKER RESET", alert);
            case EXECUTION_ERROR -> renderWithHeader("EXECUTION ERROR", alert);
            case EMERGENCY_STOP -> String.format(
                    "<b>EMERGENCY STOP</b>\n%s\n<b>Action:</b> Trading halted\n<b>Time:</b> %s",
                    alert.getMessage(),
                    TIME_FORMAT.format(alert.getTimestamp()));
        };
    }

    private String renderWithHeader(String header, Alert alert) {
        return String.format(
                "<b>%s</b>\n%s\n<b>Time:</b> %s", header, alert.getMessage(), TIME_FORMAT.format(alert.getTimestamp()));
    }
}
