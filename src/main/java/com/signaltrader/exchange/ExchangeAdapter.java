package com.signaltrader.exchange;

import com.signaltrader.domain.model.Candle;
import com.signaltrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Boundary to the derivatives exchange. All failures surface as
 * {@link com.signaltrader.exception.ExchangeException} carrying an
 * {@link com.signaltrader.exception.ExchangeErrorType}.
 *
 * <p>Orders are identified by the caller-generated client order id, which is also the
 * idempotency key: {@link #getOrderStatus} by client order id must be able to answer
 * whether an earlier, possibly timed-out submission reached the exchange.
 */
public interface ExchangeAdapter {

    AccountSnapshot getBalance();

    BigDecimal getTicker(String symbol);

    /** Most recent candles, oldest first. {@code interval} uses exchange codes such as 1m, 5m, 1h. */
    List<Candle> getRecentCandles(String symbol, String interval, int limit);

    /** Submits an order and returns the exchange order id. */
    String placeOrder(OrderRequest request);

    /** Status of the order with this client order id, or a NOT_FOUND report when the exchange has none. */
    OrderStatusReport getOrderStatus(String symbol, String clientOrderId);

    void cancelOrder(String symbol, String clientOrderId);

    /** Closes the whole position at market with a reduce-only order. */
    ClosePositionResult closePosition(Position position);

    /** Whether the exchange still holds {@code position}; false once it was liquidated or flattened. */
    boolean hasOpenPosition(Position position);

    /** Applies the leverage for subsequent orders on {@code symbol}. */
    default void setLeverage(String symbol, int leverage) {}

    /** The exchange's leverage ceiling for {@code symbol}, if it reports one. */
    default Optional<Integer> getMaxLeverage(String symbol) {
        return Optional.empty();
    }
}
