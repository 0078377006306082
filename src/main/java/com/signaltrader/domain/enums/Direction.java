package com.signaltrader.domain.enums;

/**
 * Directional opinion of a signal or trade intent.
 *
 * <p>The sign is used by the consensus aggregator when folding weighted scores:
 * BUY contributes +1, SELL contributes -1 and HOLD contributes nothing.
 */
public enum Direction {
    BUY(1),
    SELL(-1),
    HOLD(0);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    /** Maps a tradeable direction to the order side that opens it. HOLD has no side. */
    public OrderSide toOrderSide() {
        return switch (this) {
            case BUY -> OrderSide.BUY;
            case SELL -> OrderSide.SELL;
            case HOLD -> throw new IllegalStateException("HOLD has no order side");
        };
    }
}
