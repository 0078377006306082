package com.signaltrader.domain.enums;

/** PAPER simulates fills against live prices, LIVE routes orders to the exchange. */
public enum ExchangeMode {
    PAPER,
    LIVE
}
