package com.signaltrader.exception;

import java.util.Map;

/** An operator request that is well-formed but not allowed in the current trading state. */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
