package com.signaltrader.unit.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.model.SymbolStats;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.event.TradingEvent;
import com.signaltrader.event.TradingEventType;
import com.signaltrader.exception.ExchangeErrorType;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exchange.ExchangeAdapter;
import com.signaltrader.ledger.TradeLedger;
import com.signaltrader.market.SymbolStatsService;
import com.signaltrader.testsupport.MarketFixtures;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SymbolStatsServiceTest {

    @Mock
    private TradeLedger tradeLedger;

    @Mock
    private ExchangeAdapter exchangeAdapter;

    private SymbolStatsService symbolStatsService;

    @BeforeEach
    void setUp() {
        symbolStatsService = new SymbolStatsService(tradeLedger, exchangeAdapter, new TradingProperties());
    }

    @Test
    @DisplayName("Win rate is the share of profitable closed trades")
    void winRateFromLedger() {
        when(tradeLedger.closedTrades("BTCUSDT")).thenReturn(trades("5", "-1", "2", "3", "-4", "1", "-2", "6"));

        assertThat(symbolStatsService.winRate("BTCUSDT")).isEqualTo(5.0 / 8.0);
    }

    @Test
    @DisplayName("Too little history falls back to the default win rate")
    void defaultBelowMinimum() {
        when(tradeLedger.closedTrades("ETHUSDT")).thenReturn(trades("5", "6"));

        assertThat(symbolStatsService.winRate("ETHUSDT")).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Win rate is cached until a trade on the symbol closes")
    void cacheInvalidatedOnClose() {
        when(tradeLedger.closedTrades("BTCUSDT")).thenReturn(trades("5", "-1", "2", "3", "-4"));

        symbolStatsService.winRate("BTCUSDT");
        symbolStatsService.winRate("BTCUSDT");
        verify(tradeLedger, times(1)).closedTrades("BTCUSDT");

        symbolStatsService.onTradingEvent(
                new TradingEvent(this, TradingEventType.TRADE_CLOSED, "BTCUSDT", "closed", null, null, null));
        symbolStatsService.winRate("BTCUSDT");
        verify(tradeLedger, times(2)).closedTrades("BTCUSDT");
    }

    @Test
    @DisplayName("Stats carry context volatility, price and the exchange leverage ceiling")
    void statsFromContext() {
        when(tradeLedger.closedTrades("BTCUSDT")).thenReturn(List.of());
        when(exchangeAdapter.getMaxLeverage("BTCUSDT")).thenReturn(Optional.of(20));

        SymbolStats stats = symbolStatsService.stats(MarketFixtures.context("BTCUSDT", 100, 101, 102));

        assertThat(stats.getReferencePrice()).isEqualByComparingTo("102");
        assertThat(stats.getVolatility()).isEqualTo(0.01);
        assertThat(stats.getHistoricalWinRate()).isEqualTo(0.5);
        assertThat(stats.getMaxLeverage()).isEqualTo(20);
    }

    @Test
    @DisplayName("An unavailable leverage ceiling is left unset")
    void leverageCeilingUnavailable() {
        when(tradeLedger.closedTrades("BTCUSDT")).thenReturn(List.of());
        when(exchangeAdapter.getMaxLeverage("BTCUSDT"))
                .thenThrow(new ExchangeException(ExchangeErrorType.TRANSIENT, "timeout"));

        assertThat(symbolStatsService.stats(MarketFixtures.context("BTCUSDT", 100, 101, 102)).getMaxLeverage())
                .isNull();
    }

    private static List<Trade> trades(String... pnls) {
        List<Trade> trades = new ArrayList<>();
        for (String pnl : pnls) {
            trades.add(Trade.builder().symbol("BTCUSDT").realizedPnl(new BigDecimal(pnl)).build());
        }
        return trades;
    }
}
