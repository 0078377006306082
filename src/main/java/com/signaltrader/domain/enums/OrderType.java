package com.signaltrader.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
