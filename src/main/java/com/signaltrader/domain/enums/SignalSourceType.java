package com.signaltrader.domain.enums;

/** Built-in signal source implementations that can be declared in configuration. */
public enum SignalSourceType {
    RSI,
    MA_CROSSOVER,
    REMOTE_MODEL
}
