package com.signaltrader.exception;

/** Raised inside order submission when the emergency stop is engaged. Never retried. */
public class TradingHaltedException extends BaseException {

    public TradingHaltedException(String message) {
        super(ErrorCode.TRADING_HALTED, message);
    }
}
