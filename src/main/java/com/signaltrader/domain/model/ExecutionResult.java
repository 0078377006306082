package com.signaltrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a successful entry order. A partial fill is still a success; the
 * position is opened with {@code filledQuantity}.
 *
 * <p>Slippage is the signed fraction {@code (filledPrice - expectedPrice) / expectedPrice}.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionResult {

    boolean success;
    String orderId;
    String clientOrderId;
    String positionId;
    BigDecimal requestedQuantity;
    BigDecimal filledQuantity;
    BigDecimal filledPrice;
    BigDecimal slippage;
    BigDecimal fee;
    boolean partialFill;
}
