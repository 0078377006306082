package com.signaltrader.exchange;

import com.signaltrader.domain.enums.OrderStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Exchange view of one order. {@code fee} is null when the exchange does not report it
 * with the order; the execution engine then estimates it from the taker rate.
 */
@Value
@Builder
public class OrderStatusReport {

    String orderId;
    String clientOrderId;
    String symbol;
    OrderStatus status;
    BigDecimal filledQuantity;
    BigDecimal averagePrice;
    BigDecimal fee;

    public static OrderStatusReport notFound(String symbol, String clientOrderId) {
        return OrderStatusReport.builder()
                .clientOrderId(clientOrderId)
                .symbol(symbol)
                .status(OrderStatus.NOT_FOUND)
                .filledQuantity(BigDecimal.ZERO)
                .build();
    }

    public boolean exists() {
        return status != OrderStatus.NOT_FOUND;
    }

    public boolean hasFill() {
        return filledQuantity != null && filledQuantity.signum() > 0;
    }
}
