package com.signaltrader.domain.enums;

/** OPEN -> CLOSED or OPEN -> LIQUIDATED. Terminal states never transition again. */
public enum PositionStatus {
    OPEN,
    CLOSED,
    LIQUIDATED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
