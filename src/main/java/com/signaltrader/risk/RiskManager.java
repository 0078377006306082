package com.signaltrader.risk;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.SymbolStats;
import com.signaltrader.domain.model.TradeIntent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade risk and leverage sizing.
 *
 * <p>Turns a {@link TradeIntent} into a {@link RiskDecision}:
 * <ol>
 *   <li><b>Circuit breaker:</b> a tripped breaker rejects immediately, nothing else is computed.</li>
 *   <li><b>Size:</b> {@code equity * baseRiskFraction * confidenceScalar}, capped at
 *       {@code equity * maxPositionFraction}. The scalar grows with how far the aggregate
 *       confidence sits above the consensus threshold.</li>
 *   <li><b>Leverage:</b> {@code floor(clamp(baseLeverage / (1 + volatility * volatilityScale), 1, maxLeverage))}.</li>
 *   <li><b>Liquidation:</b> {@code entry * (1 -/+ (1/leverage - maintenanceMarginRate))}.</li>
 *   <li><b>Exits:</b> stop-loss and take-profit percentages scaled by historical win rate,
 *       with the stop-loss pulled inside {@code (1 - liquidationSafetyMargin)} of the
 *       liquidation distance.</li>
 * </ol>
 *
 * <p>All failed checks are collected; the first one is the decision's rejection reason.
 * Every approved decision satisfies {@code |stopLoss - entry| < |liquidation - entry|}.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private static final int PRICE_SCALE = 8;
    private static final int FRACTION_SCALE = 10;

    private final TradingCircuitBreaker circuitBreaker;
    private final TradingProperties tradingProperties;

    public RiskManager(TradingCircuitBreaker circuitBreaker, TradingProperties tradingProperties) {
        this.circuitBreaker = circuitBreaker;
        this.tradingProperties = tradingProperties;
    }

    // ========================
    // EVALUATION
    // ========================

    public RiskDecision evaluate(TradeIntent intent, AccountState account, SymbolStats stats) {
        CircuitBreakerState breakerState = circuitBreaker.evaluate(account);
        if (breakerState.isTripped()) {
            log.warn(
                    "Intent {} {} rejected: circuit breaker {}",
                    intent.getDirection(),
                    intent.getSymbol(),
                    breakerState);
            return RiskDecision.rejected(
                    intent, RejectionReason.CIRCUIT_BREAKER_TRIPPED, "circuit breaker is " + breakerState);
        }

        TradingProperties.Risk risk = tradingProperties.getRisk();
        List<RiskViolation> violations = new ArrayList<>();

        checkPositionCaps(intent, account, risk, violations);

        BigDecimal price = stats.getReferencePrice();
        if (price == null || price.signum() <= 0) {
            violations.add(RiskViolation.of(
                    RejectionReason.INVALID_MARKET_PRICE, "no usable market price for " + intent.getSymbol()));
            return reject(intent, violations);
        }

        BigDecimal positionSize = positionSize(intent.getAggregateConfidence(), account.getEquity());
        BigDecimal available = account.getAvailableMargin();
        if (positionSize.signum() <= 0 || positionSize.compareTo(available) > 0) {
            violations.add(RiskViolation.of(
                    RejectionReason.INSUFFICIENT_MARGIN,
                    "position size " + positionSize.toPlainString() + " exceeds available margin "
                            + available.toPlainString()));
        }

        int leverage = leverage(stats.getVolatility());
        Integer exchangeMax = stats.getMaxLeverage();
        if (exchangeMax != null && leverage > exchangeMax) {
            violations.add(RiskViolation.of(
                    RejectionReason.LEVERAGE_CEILING_EXCEEDED,
                    "leverage " + leverage + "x exceeds exchange maximum " + exchangeMax + "x"));
        }

        BigDecimal leverageValue = BigDecimal.valueOf(leverage);
        BigDecimal notional = positionSize.multiply(leverageValue).setScale(PRICE_SCALE, RoundingMode.DOWN);
        BigDecimal quantity = notional.divide(price, PRICE_SCALE, RoundingMode.DOWN);
        if (notional.compareTo(risk.getMinOrderNotional()) < 0 || quantity.signum() <= 0) {
            violations.add(RiskViolation.of(
                    RejectionReason.BELOW_MIN_ORDER_SIZE,
                    "notional " + notional.toPlainString() + " below minimum "
                            + risk.getMinOrderNotional().toPlainString()));
        }

        double liquidationFraction = liquidationFraction(leverage);
        double stopLossFraction = stopLossFraction(stats.getHistoricalWinRate(), liquidationFraction);
        double takeProfitFraction = takeProfitFraction(stats.getHistoricalWinRate());
        if (liquidationFraction <= 0 || stopLossFraction <= 0) {
            violations.add(RiskViolation.of(
                    RejectionReason.LIQUIDATION_TOO_CLOSE,
                    "no room for a stop-loss before liquidation at " + leverage + "x"));
            return reject(intent, violations);
        }

        OrderSide side = intent.getDirection().toOrderSide();
        BigDecimal stopLossPrice = priceAt(price, side, -stopLossFraction);
        BigDecimal takeProfitPrice = priceAt(price, side, takeProfitFraction);
        BigDecimal liquidationPrice = priceAt(price, side, -liquidationFraction);

        BigDecimal stopDistance = stopLossPrice.subtract(price).abs();
        BigDecimal liquidationDistance = liquidationPrice.subtract(price).abs();
        if (stopDistance.compareTo(liquidationDistance) >= 0) {
            violations.add(RiskViolation.of(
                    RejectionReason.LIQUIDATION_TOO_CLOSE,
                    "stop-loss " + stopLossPrice.toPlainString() + " not inside liquidation "
                            + liquidationPrice.toPlainString()));
        }

        if (!violations.isEmpty()) {
            return reject(intent, violations);
        }

        log.info(
                "Intent {} {} approved: size={} lev={}x qty={} entry~{} SL={} TP={} liq={}",
                side,
                intent.getSymbol(),
                positionSize.toPlainString(),
                leverage,
                quantity.toPlainString(),
                price.toPlainString(),
                stopLossPrice.toPlainString(),
                takeProfitPrice.toPlainString(),
                liquidationPrice.toPlainString());

        return RiskDecision.builder()
                .intent(intent)
                .symbol(intent.getSymbol())
                .side(side)
                .positionSize(positionSize)
                .notional(notional)
                .quantity(quantity)
                .leverage(leverageValue)
                .entryPriceHint(price)
                .stopLossPrice(stopLossPrice)
                .takeProfitPrice(takeProfitPrice)
                .liquidationPrice(liquidationPrice)
                .rejected(false)
                .build();
    }

    // ========================
    // FORMULAS
    // ========================

    /** Collateral to commit: equity * baseRiskFraction * confidenceScalar, capped by maxPositionFraction. */
    public BigDecimal positionSize(double aggregateConfidence, BigDecimal equity) {
        if (equity == null || equity.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PRICE_SCALE);
        }
        TradingProperties.Risk risk = tradingProperties.getRisk();
        BigDecimal raw = equity.multiply(BigDecimal.valueOf(risk.getBaseRiskFraction()))
                .multiply(BigDecimal.valueOf(confidenceScalar(aggregateConfidence)));
        BigDecimal cap = equity.multiply(BigDecimal.valueOf(risk.getMaxPositionFraction()));
        return raw.min(cap).setScale(PRICE_SCALE, RoundingMode.DOWN);
    }

    public double confidenceScalar(double aggregateConfidence) {
        TradingProperties.Risk risk = tradingProperties.getRisk();
        double threshold = tradingProperties.getConsensus().getThreshold();
        double scalar = 1.0 + risk.getConfidenceSensitivity() * (aggregateConfidence - threshold);
        return round(clamp(scalar, risk.getMinConfidenceScalar(), risk.getMaxConfidenceScalar()));
    }

    /** Whole-number leverage, decreasing as volatility rises. */
    public int leverage(double volatility) {
        TradingProperties.Risk risk = tradingProperties.getRisk();
        double factor = Math.max(0.0, volatility) * risk.getVolatilityScale();
        double raw = risk.getBaseLeverage() / (1.0 + factor);
        return (int) Math.floor(clamp(raw, 1.0, risk.getMaxLeverage()));
    }

    /** Adverse move, as a fraction of entry, at which the position is liquidated. */
    public double liquidationFraction(int leverage) {
        return round(1.0 / leverage - tradingProperties.getRisk().getMaintenanceMarginRate());
    }

    /**
     * Stop-loss fraction scaled by win rate and clamped to its bounds, then tightened to
     * stay inside the liquidation distance minus the safety margin.
     */
    public double stopLossFraction(double winRate, double liquidationFraction) {
        TradingProperties.Risk risk = tradingProperties.getRisk();
        double scaled = clamp(
                risk.getStopLoss() * winRateFactor(winRate), risk.getMinStopLoss(), risk.getMaxStopLoss());
        double ceiling = liquidationFraction * (1.0 - risk.getLiquidationSafetyMargin());
        if (scaled >= ceiling) {
            log.debug(
                    "Stop-loss {} tightened to {} to stay inside liquidation {}", scaled, ceiling, liquidationFraction);
            scaled = ceiling;
        }
        return round(scaled);
    }

    public double takeProfitFraction(double winRate) {
        TradingProperties.Risk risk = tradingProperties.getRisk();
        return round(clamp(
                risk.getTakeProfit() * winRateFactor(winRate), risk.getMinTakeProfit(), risk.getMaxTakeProfit()));
    }

    // ========================
    // INTERNALS
    // ========================

    private void checkPositionCaps(
            TradeIntent intent, AccountState account, TradingProperties.Risk risk, List<RiskViolation> violations) {
        long symbolOpen = account.openPositionCount(intent.getSymbol());
        if (symbolOpen >= risk.getMaxPositionsPerSymbol()) {
            violations.add(RiskViolation.of(
                    RejectionReason.SYMBOL_POSITION_CAP,
                    symbolOpen + " open position(s) on " + intent.getSymbol() + ", cap "
                            + risk.getMaxPositionsPerSymbol()));
        }
        int totalOpen = account.getOpenPositionCount();
        if (totalOpen >= risk.getMaxOpenPositions()) {
            violations.add(RiskViolation.of(
                    RejectionReason.PORTFOLIO_POSITION_CAP,
                    totalOpen + " open positions, cap " + risk.getMaxOpenPositions()));
        }
    }

    private RiskDecision reject(TradeIntent intent, List<RiskViolation> violations) {
        log.warn("Intent {} {} rejected: {}", intent.getDirection(), intent.getSymbol(), violations);
        return RiskDecision.rejected(intent, violations);
    }

    private double winRateFactor(double winRate) {
        return 1.0 + (winRate - 0.5) * tradingProperties.getRisk().getWinRateSensitivity();
    }

    /** entry * (1 + signedFraction) for a long; the move is mirrored for a short. */
    private static BigDecimal priceAt(BigDecimal entry, OrderSide side, double signedFraction) {
        double move = side.isLong() ? signedFraction : -signedFraction;
        return entry.multiply(BigDecimal.ONE.add(BigDecimal.valueOf(move)))
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(FRACTION_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
