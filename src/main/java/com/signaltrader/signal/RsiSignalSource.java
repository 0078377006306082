package com.signaltrader.signal;

import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.SignalScore;
import java.util.Optional;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Mean-reversion opinion from the relative strength index.
 *
 * <p>Below the oversold level the source says BUY, above overbought it says SELL.
 * Confidence starts at 0.5 at the threshold and reaches 1.0 at RSI 0 (or 100).
 * In between it says HOLD. With fewer than period + 1 candles it has no opinion.
 */
public class RsiSignalSource implements SignalSource {

    private final String id;
    private final int period;
    private final double oversold;
    private final double overbought;

    public RsiSignalSource(String id, int period, double oversold, double overbought) {
        if (oversold <= 0 || overbought >= 100 || oversold >= overbought) {
            throw new IllegalArgumentException("RSI levels must satisfy 0 < oversold < overbought < 100");
        }
        this.id = id;
        this.period = period;
        this.oversold = oversold;
        this.overbought = overbought;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Optional<SignalScore> score(String symbol, MarketContext marketContext) {
        if (marketContext.size() <= period) {
            return Optional.empty();
        }
        BarSeries series = CandleSeries.toBarSeries(marketContext);
        RSIIndicator rsi = new RSIIndicator(new ClosePriceIndicator(series), period);
        double value = rsi.getValue(series.getEndIndex()).doubleValue();
        if (Double.isNaN(value)) {
            return Optional.empty();
        }

        if (value < oversold) {
            return Optional.of(SignalScore.of(Direction.BUY, clamp(0.5 + 0.5 * (oversold - value) / oversold)));
        }
        if (value > overbought) {
            return Optional.of(
                    SignalScore.of(Direction.SELL, clamp(0.5 + 0.5 * (value - overbought) / (100.0 - overbought))));
        }
        return Optional.of(SignalScore.of(Direction.HOLD, 0.5));
    }

    private static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
