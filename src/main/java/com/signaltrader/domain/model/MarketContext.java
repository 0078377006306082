package com.signaltrader.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of recent market data handed to every signal source in a cycle.
 *
 * <p>Volatility is the standard deviation of log returns over the candle window.
 */
@Value
@Builder
public class MarketContext {

    String symbol;
    BigDecimal lastPrice;
    List<Candle> candles;
    Duration candleInterval;
    double volatility;
    Instant asOf;

    public int size() {
        return candles == null ? 0 : candles.size();
    }
}
