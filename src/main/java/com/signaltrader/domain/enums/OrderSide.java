package com.signaltrader.domain.enums;

/** Buy or sell side of an order. For a position, BUY is long and SELL is short. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for closing orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    public boolean isLong() {
        return this == BUY;
    }
}
