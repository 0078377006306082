package com.signaltrader.domain.enums;

/**
 * Exchange-side lifecycle of an order, as reported by a status lookup.
 *
 * <p>NOT_FOUND means the exchange has no record of the client order id, which is the
 * only state in which a resubmission is allowed.
 */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED,
    EXPIRED,
    NOT_FOUND;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED || this == EXPIRED;
    }
}
