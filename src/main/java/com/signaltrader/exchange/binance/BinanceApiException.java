package com.signaltrader.exchange.binance;

import com.signaltrader.exception.ExchangeErrorType;
import com.signaltrader.exception.ExchangeException;
import lombok.Getter;

/** Exchange error carrying Binance's numeric error code (0 when the body had none). */
@Getter
public class BinanceApiException extends ExchangeException {

    static final int ORDER_DOES_NOT_EXIST = -2013;
    static final int UNKNOWN_ORDER_SENT = -2011;

    private final int exchangeCode;
    private final int httpStatus;

    public BinanceApiException(ExchangeErrorType errorType, int httpStatus, int exchangeCode, String message) {
        super(errorType, message);
        this.exchangeCode = exchangeCode;
        this.httpStatus = httpStatus;
    }

    public boolean isOrderNotFound() {
        return exchangeCode == ORDER_DOES_NOT_EXIST || exchangeCode == UNKNOWN_ORDER_SENT;
    }
}
