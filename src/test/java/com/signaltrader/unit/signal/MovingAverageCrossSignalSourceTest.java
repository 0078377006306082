package com.signaltrader.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.model.SignalScore;
import com.signaltrader.signal.MovingAverageCrossSignalSource;
import com.signaltrader.testsupport.MarketFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MovingAverageCrossSignalSourceTest {

    private final MovingAverageCrossSignalSource source = new MovingAverageCrossSignalSource("ema-9-21", 9, 21, 50);

    @Test
    @DisplayName("Fast EMA above slow in an uptrend says BUY")
    void uptrendBuys() {
        SignalScore score = scoreOf(MarketFixtures.trend(100, 1, 40));

        assertThat(score.getDirection()).isEqualTo(Direction.BUY);
        assertThat(score.getConfidence()).isGreaterThan(0.5).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Fast EMA below slow in a downtrend says SELL")
    void downtrendSells() {
        SignalScore score = scoreOf(MarketFixtures.trend(140, -1, 40));

        assertThat(score.getDirection()).isEqualTo(Direction.SELL);
    }

    @Test
    @DisplayName("A flat market holds")
    void flatHolds() {
        SignalScore score = scoreOf(MarketFixtures.trend(100, 0, 40));

        assertThat(score.getDirection()).isEqualTo(Direction.HOLD);
    }

    @Test
    @DisplayName("No opinion with fewer candles than the slow period")
    void notEnoughCandles() {
        assertThat(source.score("BTCUSDT", MarketFixtures.context("BTCUSDT", MarketFixtures.trend(100, 1, 20))))
                .isEmpty();
    }

    @Test
    @DisplayName("Fast period must be shorter than slow")
    void validatesPeriods() {
        assertThatThrownBy(() -> new MovingAverageCrossSignalSource("bad", 21, 9, 50))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private SignalScore scoreOf(double[] closes) {
        return source.score("BTCUSDT", MarketFixtures.context("BTCUSDT", closes)).orElseThrow();
    }
}
