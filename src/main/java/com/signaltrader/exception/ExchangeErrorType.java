package com.signaltrader.exception;

/**
 * Classification of exchange failures. Only the first three are worth retrying;
 * the rest mean the same request will fail again.
 */
public enum ExchangeErrorType {
    RATE_LIMITED(true),
    TRANSIENT(true),
    UNKNOWN(true),
    INSUFFICIENT_FUNDS(false),
    INVALID_REQUEST(false);

    private final boolean retryable;

    ExchangeErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
