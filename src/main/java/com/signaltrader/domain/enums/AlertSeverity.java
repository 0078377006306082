package com.signaltrader.domain.enums;

/**
 * Severity level for operator alerts.
 *
 * <p>Ordinal ordering is used by TelegramNotifier's priority queue
 * so that CRITICAL messages are sent first when rate-limited.
 */
public enum AlertSeverity {

    /** Trading halted or money at risk. */
    CRITICAL,

    /** Requires operator attention but trading continues. */
    WARNING,

    /** Informational, no action required. */
    INFO
}
