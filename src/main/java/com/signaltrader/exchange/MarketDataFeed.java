package com.signaltrader.exchange;

import com.signaltrader.domain.model.Candle;
import java.math.BigDecimal;
import java.util.List;

/** Public price data, shared by the paper and live exchange adapters. */
public interface MarketDataFeed {

    BigDecimal getLastPrice(String symbol);

    List<Candle> getCandles(String symbol, String interval, int limit);
}
