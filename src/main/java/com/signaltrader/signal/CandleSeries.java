package com.signaltrader.signal;

import com.signaltrader.domain.model.Candle;
import com.signaltrader.domain.model.MarketContext;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/** Converts the candles of a {@link MarketContext} into a ta4j {@link BarSeries}. */
final class CandleSeries {

    private CandleSeries() {}

    static BarSeries toBarSeries(MarketContext marketContext) {
        Duration interval = marketContext.getCandleInterval() != null
                ? marketContext.getCandleInterval()
                : Duration.ofMinutes(1);
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(marketContext.getSymbol())
                .withMaxBarCount(Math.max(marketContext.size(), 1))
                .build();

        Instant previousEnd = null;
        for (Candle candle : marketContext.getCandles()) {
            Instant end = candle.getCloseTime() != null ? candle.getCloseTime() : candle.getOpenTime().plus(interval);
            if (previousEnd != null && !end.isAfter(previousEnd)) {
                // ta4j requires strictly increasing end times
                continue;
            }
            series.addBar(
                    interval,
                    end.atZone(ZoneOffset.UTC),
                    candle.getOpen(),
                    candle.getHigh(),
                    candle.getLow(),
                    candle.getClose(),
                    candle.getVolume() != null ? candle.getVolume() : BigDecimal.ZERO);
            previousEnd = end;
        }
        return series;
    }
}
