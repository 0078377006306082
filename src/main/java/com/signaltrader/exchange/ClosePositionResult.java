package com.signaltrader.exchange;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Fill of the reduce-only order that flattened a position. {@code fee} may be null. */
@Value
@Builder
public class ClosePositionResult {

    String orderId;
    BigDecimal exitPrice;
    BigDecimal quantity;
    BigDecimal fee;
}
