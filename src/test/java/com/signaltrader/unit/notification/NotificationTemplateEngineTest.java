package com.signaltrader.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.signaltrader.domain.enums.AlertSeverity;
import com.signaltrader.event.TradingEventType;
import com.signaltrader.notification.Alert;
import com.signaltrader.notification.NotificationTemplateEngine;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class NotificationTemplateEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-10T10:15:30Z");

    private final NotificationTemplateEngine engine = new NotificationTemplateEngine();

    private static Alert alert(TradingEventType type, String message) {
        return Alert.builder()
                .type(type)
                .severity(AlertSeverity.INFO)
                .title(type.name())
                .message(message)
                .timestamp(NOW)
                .build();
    }

    @Test
    void render_tradeOpened_hasHeaderMessageAndTime() {
        String text = engine.render(alert(TradingEventType.TRADE_OPENED, "BUY BTCUSDT 4.8 @ 100"));

        assertThat(text)
                .startsWith("<b>POSITION OPENED</b>")
                .contains("BUY BTCUSDT 4.8 @ 100")
                .contains("<b>Time:</b> 2025-03-10 10:15:30 UTC");
    }

    @Test
    void render_breakerTrip_statesTheAction() {
        String text = engine.render(alert(TradingEventType.CIRCUIT_BREAKER_TRIPPED, "daily loss 26.00"));

        assertThat(text)
                .startsWith("<b>CIRCUIT BREAKER TRIPPED</b>")
                .contains("New entries blocked until re-armed");
    }

    @Test
    void render_emergencyStop_statesTradingHalted() {
        String text = engine.render(alert(TradingEventType.EMERGENCY_STOP, "operator"));

        assertThat(text).startsWith("<b>EMERGENCY STOP</b>").contains("Trading halted");
    }

    @Test
    void render_everyEventTypeHasATemplate() {
        for (TradingEventType type : TradingEventType.values()) {
            assertThat(engine.render(alert(type, "m"))).contains("<b>").contains("m");
        }
    }
}
