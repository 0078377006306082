package com.signaltrader.market;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.SymbolStats;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.event.TradingEvent;
import com.signaltrader.event.TradingEventType;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exchange.ExchangeAdapter;
import com.signaltrader.ledger.TradeLedger;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Per-symbol inputs to the risk manager: historical win rate from the ledger's closed
 * trades and the exchange's leverage ceiling.
 *
 * <p>Win rates are cached in Caffeine and evicted for a symbol whenever one of its trades
 * closes. Below {@code winRateMinTrades} closed trades the configured default is used.
 */
@Service
public class SymbolStatsService {

    private static final Logger log = LoggerFactory.getLogger(SymbolStatsService.class);

    private final TradeLedger tradeLedger;
    private final ExchangeAdapter exchangeAdapter;
    private final TradingProperties tradingProperties;

    /** Key: symbol, value: win rate in [0, 1]. */
    private final Cache<String, Double> winRateCache;

    public SymbolStatsService(
            TradeLedger tradeLedger, ExchangeAdapter exchangeAdapter, TradingProperties tradingProperties) {
        this.tradeLedger = tradeLedger;
        this.exchangeAdapter = exchangeAdapter;
        this.tradingProperties = tradingProperties;
        this.winRateCache = Caffeine.newBuilder()
                .expireAfterWrite(tradingProperties.getRisk().getWinRateCacheTtl())
                .maximumSize(500)
                .build();
    }

    public SymbolStats stats(MarketContext context) {
        String symbol = context.getSymbol();
        return SymbolStats.builder()
                .symbol(symbol)
                .volatility(context.getVolatility())
                .historicalWinRate(winRate(symbol))
                .referencePrice(context.getLastPrice())
                .maxLeverage(maxLeverage(symbol))
                .build();
    }

    public double winRate(String symbol) {
        return winRateCache.get(symbol, this::loadWinRate);
    }

    @EventListener
    public void onTradingEvent(TradingEvent event) {
        if (event.getEventType() == TradingEventType.TRADE_CLOSED && event.getSymbol() != null) {
            winRateCache.invalidate(event.getSymbol());
        }
    }

    private double loadWinRate(String symbol) {
        TradingProperties.Risk risk = tradingProperties.getRisk();
        List<Trade> trades = tradeLedger.closedTrades(symbol);
        if (trades.size() < risk.getWinRateMinTrades()) {
            return risk.getDefaultWinRate();
        }
        long wins = trades.stream().filter(Trade::isWin).count();
        double winRate = (double) wins / trades.size();
        log.debug("Win rate {}: {}/{} = {}", symbol, wins, trades.size(), winRate);
        return winRate;
    }

    private Integer maxLeverage(String symbol) {
        try {
            Optional<Integer> max = exchangeAdapter.getMaxLeverage(symbol);
            return max.orElse(null);
        } catch (ExchangeException e) {
            log.warn("Leverage ceiling for {} unavailable: {}", symbol, e.getMessage());
            return null;
        }
    }
}
