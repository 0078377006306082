package com.signaltrader.event;

public enum TradingEventType {
    TRADE_OPENED,
    TRADE_CLOSED,
    CIRCUIT_BREAKER_TRIPPED,
    CIRCUIT_BREAKER_RESET,
    EXECUTION_ERROR,
    EMERGENCY_STOP
}
