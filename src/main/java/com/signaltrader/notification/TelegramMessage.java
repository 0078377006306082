package com.signaltrader.notification;

import com.signaltrader.domain.enums.AlertSeverity;
import lombok.Builder;
import lombok.Data;

/** Message queued for Telegram delivery; the queue orders by severity, CRITICAL first. */
@Data
@Builder
public class TelegramMessage {

    private String text;
    private AlertSeverity severity;
    private long timestamp;
}
