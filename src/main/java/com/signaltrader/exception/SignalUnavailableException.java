package com.signaltrader.exception;

/** A signal source could not produce a score this cycle. The collector drops the source for the cycle. */
public class SignalUnavailableException extends BaseException {

    public SignalUnavailableException(String sourceId, String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, sourceId + ": " + message, cause);
    }

    public SignalUnavailableException(String sourceId, String message) {
        super(ErrorCode.INTERNAL_ERROR, sourceId + ": " + message);
    }
}
