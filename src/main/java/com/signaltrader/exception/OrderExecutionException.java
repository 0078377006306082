package com.signaltrader.exception;

import com.signaltrader.domain.enums.RejectionReason;
import java.util.Map;
import lombok.Getter;

/** Entry order could not be executed; the intent has already been recorded as rejected when this is thrown. */
@Getter
public class OrderExecutionException extends BaseException {

    private final String symbol;
    private final String clientOrderId;

    public OrderExecutionException(String symbol, String clientOrderId, String message) {
        super(ErrorCode.ORDER_EXECUTION_FAILED, message, details(symbol, clientOrderId));
        this.symbol = symbol;
        this.clientOrderId = clientOrderId;
    }

    public OrderExecutionException(String symbol, String clientOrderId, String message, Throwable cause) {
        super(ErrorCode.ORDER_EXECUTION_FAILED, message, details(symbol, clientOrderId), cause);
        this.symbol = symbol;
        this.clientOrderId = clientOrderId;
    }

    public RejectionReason getRejectionReason() {
        return RejectionReason.EXECUTION_FAILED;
    }

    private static Map<String, Object> details(String symbol, String clientOrderId) {
        return clientOrderId == null
                ? Map.of("symbol", symbol)
                : Map.of("symbol", symbol, "clientOrderId", clientOrderId);
    }
}
