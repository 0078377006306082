package com.signaltrader.config;

import com.signaltrader.domain.enums.ExchangeMode;
import com.signaltrader.domain.enums.OrderType;
import com.signaltrader.domain.enums.SignalSourceType;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Every tunable of the decision-to-execution pipeline, bound from {@code signaltrader.*}.
 *
 * <p>Fractions (risk, stop distances, loss limits, fee rates) are plain decimals,
 * so 0.02 means 2%. Defaults here are the values the system runs with when
 * application.yml is silent.
 */
@Data
@Component
@ConfigurationProperties(prefix = "signaltrader")
public class TradingProperties {

    /** Symbols traded by the decision cycle, e.g. BTCUSDT. */
    private List<String> symbols = new ArrayList<>(List.of("BTCUSDT", "ETHUSDT"));

    private Account account = new Account();
    private Cycle cycle = new Cycle();
    private List<Source> sources = new ArrayList<>();
    private Consensus consensus = new Consensus();
    private Risk risk = new Risk();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Execution execution = new Execution();
    private Positions positions = new Positions();
    private Exchange exchange = new Exchange();

    @Data
    public static class Account {
        private BigDecimal initialEquity = new BigDecimal("1000");
        /** Zone in which trading days roll over for the daily loss limit. */
        private String zone = "UTC";
    }

    @Data
    public static class Cycle {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(60);
        private Duration initialDelay = Duration.ofSeconds(5);
        /** Binance kline interval code, e.g. 1m, 5m, 1h. */
        private String candleInterval = "5m";
        private int candleLimit = 100;
    }

    @Data
    public static class Source {
        private String id;
        private SignalSourceType type;
        private double weight = 1.0;
        private boolean enabled = true;

        // RSI
        private int period = 14;
        private double oversold = 30.0;
        private double overbought = 70.0;

        // MA crossover
        private int fastPeriod = 9;
        private int slowPeriod = 21;
        /** Confidence gained per unit of relative EMA spread. */
        private double sensitivity = 50.0;

        // remote model
        private String url;
    }

    @Data
    public static class Consensus {
        /** |net score| must exceed this to produce an intent. */
        private double threshold = 0.6;
        /** Minimum fraction of configured sources that must respond. */
        private double minQuorum = 0.3;
        private Duration sourceTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Risk {
        private double baseRiskFraction = 0.1;
        private double maxPositionFraction = 0.5;
        private double confidenceSensitivity = 1.0;
        private double minConfidenceScalar = 0.5;
        private double maxConfidenceScalar = 1.5;

        private int baseLeverage = 5;
        private int maxLeverage = 10;
        /** Leverage is divided by (1 + volatility * volatilityScale). */
        private double volatilityScale = 10.0;
        private double maintenanceMarginRate = 0.005;
        /** Stop distance must stay below liquidation distance * (1 - safety margin). */
        private double liquidationSafetyMargin = 0.2;

        private double stopLoss = 0.02;
        private double takeProfit = 0.05;
        private double minStopLoss = 0.005;
        private double maxStopLoss = 0.05;
        private double minTakeProfit = 0.01;
        private double maxTakeProfit = 0.12;
        private double winRateSensitivity = 1.0;
        private double defaultWinRate = 0.5;
        /** Closed trades needed before a symbol's own win rate replaces the default. */
        private int winRateMinTrades = 5;
        private Duration winRateCacheTtl = Duration.ofMinutes(5);

        private BigDecimal minOrderNotional = new BigDecimal("5");
        private int maxPositionsPerSymbol = 1;
        private int maxOpenPositions = 5;
    }

    @Data
    public static class CircuitBreaker {
        /** Fraction of start-of-day equity that may be lost before trading halts for the day. */
        private double dailyLossLimit = 0.05;
        private int maxConsecutiveLosses = 3;
    }

    @Data
    public static class Execution {
        private OrderType orderType = OrderType.MARKET;
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private double backoffJitter = 0.5;
        private Duration maxBackoff = Duration.ofSeconds(8);
        private Duration fillTimeout = Duration.ofSeconds(30);
        private Duration fillPollInterval = Duration.ofMillis(500);
        /** Used when the exchange does not report the fee of a fill. */
        private BigDecimal takerFeeRate = new BigDecimal("0.0005");
    }

    @Data
    public static class Positions {
        private Duration maxHoldingTime = Duration.ofHours(24);
        private long monitorIntervalMs = 10000;
    }

    @Data
    public static class Exchange {
        private ExchangeMode mode = ExchangeMode.PAPER;
        private Paper paper = new Paper();
        private Binance binance = new Binance();
    }

    @Data
    public static class Paper {
        private int slippageBps = 5;
    }

    @Data
    public static class Binance {
        private String baseUrl = "https://fapi.binance.com";
        private String apiKey;
        private String secretKey;
        private long recvWindowMs = 5000;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        private Duration leverageCacheTtl = Duration.ofHours(1);
    }
}
