package com.signaltrader.exchange;

import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** An order as submitted to the exchange. {@code price} is only set for LIMIT orders. */
@Value
@Builder
public class OrderRequest {

    String clientOrderId;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal quantity;
    BigDecimal price;
    boolean reduceOnly;
}
