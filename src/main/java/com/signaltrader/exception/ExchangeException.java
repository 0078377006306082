package com.signaltrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Failure of a call to the exchange adapter.
 *
 * <p>A TRANSIENT error on order submission is ambiguous: the order may or may not have
 * reached the exchange. Callers must look the order up by client order id before
 * submitting again.
 */
@Getter
public class ExchangeException extends BaseException {

    private final ExchangeErrorType errorType;

    public ExchangeException(ExchangeErrorType errorType, String message) {
        super(ErrorCode.EXCHANGE_ERROR, message, Map.of("errorType", errorType.name()));
        this.errorType = errorType;
    }

    public ExchangeException(ExchangeErrorType errorType, String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_ERROR, message, Map.of("errorType", errorType.name()), cause);
        this.errorType = errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
