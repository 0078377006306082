package com.signaltrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    TRADING_HALTED("TRADING_HALTED", 423),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    LEDGER_WRITE_FAILED("LEDGER_WRITE_FAILED", 500),
    EXCHANGE_ERROR("EXCHANGE_ERROR", 502),
    ORDER_EXECUTION_FAILED("ORDER_EXECUTION_FAILED", 502);

    private final String code;
    private final int httpStatus;
}
