package com.signaltrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A single OHLCV candle for one symbol, as returned by the market data feed.
 * {@code closeTime} is the end of the interval bucket.
 */
@Value
@Builder
public class Candle {

    Instant openTime;
    Instant closeTime;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
}
