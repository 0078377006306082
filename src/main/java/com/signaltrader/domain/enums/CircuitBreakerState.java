package com.signaltrader.domain.enums;

public enum CircuitBreakerState {
    ARMED,
    TRIPPED_DAILY,
    TRIPPED_STREAK,
    TRIPPED_MANUAL;

    public boolean isTripped() {
        return this != ARMED;
    }
}
