package com.signaltrader.signal;

import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.SignalScore;
import java.util.Optional;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Trend opinion from a fast/slow EMA pair.
 *
 * <p>Fast above slow is BUY, below is SELL. Confidence is 0.5 plus the relative spread
 * {@code |fast - slow| / slow} times the sensitivity, capped at 1. A spread under
 * {@value #FLAT_SPREAD} is HOLD.
 */
public class MovingAverageCrossSignalSource implements SignalSource {

    static final double FLAT_SPREAD = 0.0005;

    private final String id;
    private final int fastPeriod;
    private final int slowPeriod;
    private final double sensitivity;

    public MovingAverageCrossSignalSource(String id, int fastPeriod, int slowPeriod, double sensitivity) {
        if (fastPeriod <= 0 || fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("EMA periods must satisfy 0 < fast < slow");
        }
        this.id = id;
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.sensitivity = sensitivity;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Optional<SignalScore> score(String symbol, MarketContext marketContext) {
        if (marketContext.size() < slowPeriod) {
            return Optional.empty();
        }
        BarSeries series = CandleSeries.toBarSeries(marketContext);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int last = series.getEndIndex();
        double fast = new EMAIndicator(close, fastPeriod).getValue(last).doubleValue();
        double slow = new EMAIndicator(close, slowPeriod).getValue(last).doubleValue();
        if (slow == 0.0 || Double.isNaN(fast) || Double.isNaN(slow)) {
            return Optional.empty();
        }

        double spread = (fast - slow) / slow;
        if (Math.abs(spread) < FLAT_SPREAD) {
            return Optional.of(SignalScore.of(Direction.HOLD, 0.5));
        }
        double confidence = Math.min(1.0, 0.5 + Math.abs(spread) * sensitivity);
        return Optional.of(SignalScore.of(spread > 0 ? Direction.BUY : Direction.SELL, confidence));
    }
}
