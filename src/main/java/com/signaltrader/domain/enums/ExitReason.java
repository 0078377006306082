package com.signaltrader.domain.enums;

/**
 * Why a position was closed. Exit checks evaluate LIQUIDATION, STOP_LOSS and
 * TAKE_PROFIT in that order, then MAX_HOLDING_TIME.
 */
public enum ExitReason {
    TAKE_PROFIT,
    STOP_LOSS,
    LIQUIDATION,
    MANUAL,
    SIGNAL_REVERSAL,
    MAX_HOLDING_TIME
}
