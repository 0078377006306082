package com.signaltrader.market;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.model.Candle;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.exchange.ExchangeAdapter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the {@link MarketContext} each decision cycle hands to the signal sources:
 * recent candles from the exchange, last traded price from the ticker, and volatility
 * as the sample standard deviation of log returns between consecutive closes.
 */
@Service
public class MarketContextService {

    private static final Logger log = LoggerFactory.getLogger(MarketContextService.class);

    private final ExchangeAdapter exchangeAdapter;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public MarketContextService(ExchangeAdapter exchangeAdapter, TradingProperties tradingProperties, Clock clock) {
        this.exchangeAdapter = exchangeAdapter;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    /** Fetches market data for {@code symbol}; exchange errors propagate to the caller. */
    public MarketContext build(String symbol) {
        TradingProperties.Cycle cycle = tradingProperties.getCycle();
        List<Candle> candles =
                exchangeAdapter.getRecentCandles(symbol, cycle.getCandleInterval(), cycle.getCandleLimit());
        BigDecimal lastPrice = exchangeAdapter.getTicker(symbol);
        double volatility = volatility(candles);

        log.debug(
                "Market context {}: {} candles, last={}, vol={}",
                symbol,
                candles.size(),
                lastPrice,
                String.format(Locale.ROOT, "%.6f", volatility));

        return MarketContext.builder()
                .symbol(symbol)
                .lastPrice(lastPrice)
                .candles(List.copyOf(candles))
                .candleInterval(parseInterval(cycle.getCandleInterval()))
                .volatility(volatility)
                .asOf(clock.instant())
                .build();
    }

    /** Sample standard deviation of log returns of the closes; 0 with fewer than three candles. */
    public static double volatility(List<Candle> candles) {
        if (candles == null || candles.size() < 3) {
            return 0.0;
        }
        double[] returns = new double[candles.size() - 1];
        int n = 0;
        for (int i = 1; i < candles.size(); i++) {
            BigDecimal previous = candles.get(i - 1).getClose();
            BigDecimal current = candles.get(i).getClose();
            if (previous == null || current == null || previous.signum() <= 0 || current.signum() <= 0) {
                continue;
            }
            returns[n++] = Math.log(current.doubleValue() / previous.doubleValue());
        }
        if (n < 2) {
            return 0.0;
        }

        double mean = 0.0;
        for (int i = 0; i < n; i++) {
            mean += returns[i];
        }
        mean /= n;

        double sumSquares = 0.0;
        for (int i = 0; i < n; i++) {
            double diff = returns[i] - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / (n - 1));
    }

    /**
     * Parses exchange interval codes: a count followed by s, m, h, d or w ("5m", "1h").
     *
     * @throws IllegalArgumentException for anything else
     */
    public static Duration parseInterval(String interval) {
        if (interval == null || interval.length() < 2) {
            throw new IllegalArgumentException("Invalid candle interval: " + interval);
        }
        char unit = interval.charAt(interval.length() - 1);
        long amount;
        try {
            amount = Long.parseLong(interval.substring(0, interval.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid candle interval: " + interval, e);
        }
        return switch (unit) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            case 'w' -> Duration.ofDays(7 * amount);
            default -> throw new IllegalArgumentException("Invalid candle interval: " + interval);
        };
    }
}
