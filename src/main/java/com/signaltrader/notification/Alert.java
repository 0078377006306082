package com.signaltrader.notification;

import com.signaltrader.domain.enums.AlertSeverity;
import com.signaltrader.event.TradingEventType;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** A trading event rendered for operators, before channel formatting. */
@Data
@Builder
public class Alert {

    private TradingEventType type;
    private AlertSeverity severity;
    private String title;
    private String message;
    private Instant timestamp;
}
