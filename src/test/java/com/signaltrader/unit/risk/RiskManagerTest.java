package com.signaltrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.OpenExposure;
import com.signaltrader.domain.model.SymbolStats;
import com.signaltrader.domain.model.TradeIntent;
import com.signaltrader.risk.RiskDecision;
import com.signaltrader.risk.RiskManager;
import com.signaltrader.risk.RiskViolation;
import com.signaltrader.risk.TradingCircuitBreaker;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for RiskManager: sizing, leverage, exit levels, every rejection reason and
 * the stop-loss inside liquidation guarantee.
 */
@ExtendWith(MockitoExtension.class)
class RiskManagerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Mock
    private TradingCircuitBreaker circuitBreaker;

    private TradingProperties tradingProperties;
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        tradingProperties = new TradingProperties();
        riskManager = new RiskManager(circuitBreaker, tradingProperties);
        lenient().when(circuitBreaker.evaluate(any(AccountState.class))).thenReturn(CircuitBreakerState.ARMED);
    }

    // ==============================
    // APPROVAL
    // ==============================

    @Nested
    @DisplayName("Approved decisions")
    class Approved {

        @Test
        @DisplayName("Equity 1000 at confidence 0.8 commits 120 of collateral")
        void sizesPositionFromConfidence() {
            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account("1000"), stats(0.01));

            assertThat(decision.isRejected()).isFalse();
            assertThat(decision.getPositionSize()).isEqualByComparingTo("120");
            assertThat(decision.getLeverage()).isEqualByComparingTo("4");
            assertThat(decision.getNotional()).isEqualByComparingTo("480");
            assertThat(decision.getQuantity()).isEqualByComparingTo("4.8");
            assertThat(decision.getSide()).isEqualTo(OrderSide.BUY);
        }

        @Test
        @DisplayName("Long exits: stop-loss and liquidation below entry, take-profit above")
        void longExitLevels() {
            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account("1000"), stats(0.01));

            assertThat(decision.getEntryPriceHint()).isEqualByComparingTo("100");
            assertThat(decision.getStopLossPrice()).isEqualByComparingTo("98");
            assertThat(decision.getTakeProfitPrice()).isEqualByComparingTo("105");
            assertThat(decision.getLiquidationPrice()).isEqualByComparingTo("75.5");
        }

        @Test
        @DisplayName("Short exits are mirrored around entry")
        void shortExitLevels() {
            RiskDecision decision = riskManager.evaluate(intent(Direction.SELL, 0.8), account("1000"), stats(0.01));

            assertThat(decision.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(decision.getStopLossPrice()).isEqualByComparingTo("102");
            assertThat(decision.getTakeProfitPrice()).isEqualByComparingTo("95");
            assertThat(decision.getLiquidationPrice()).isEqualByComparingTo("124.5");
        }

        @Test
        @DisplayName("Stop-loss stays strictly inside liquidation across volatility and win rate")
        void stopLossAlwaysInsideLiquidation() {
            tradingProperties.getRisk().setBaseLeverage(20);
            tradingProperties.getRisk().setMaxLeverage(20);
            tradingProperties.getRisk().setMaxStopLoss(0.2);

            for (Direction direction : new Direction[] {Direction.BUY, Direction.SELL}) {
                for (double volatility = 0.0; volatility <= 0.5; volatility += 0.01) {
                    for (double winRate = 0.0; winRate <= 1.0; winRate += 0.1) {
                        SymbolStats stats = SymbolStats.builder()
                                .symbol("BTCUSDT")
                                .volatility(volatility)
                                .historicalWinRate(winRate)
                                .referencePrice(new BigDecimal("27345.67"))
                                .build();
                        RiskDecision decision = riskManager.evaluate(intent(direction, 0.9), account("5000"), stats);
                        if (decision.isRejected()) {
                            continue;
                        }
                        BigDecimal entry = decision.getEntryPriceHint();
                        BigDecimal stopDistance = decision.getStopLossPrice().subtract(entry).abs();
                        BigDecimal liquidationDistance =
                                decision.getLiquidationPrice().subtract(entry).abs();
                        assertThat(stopDistance).isLessThan(liquidationDistance);
                        if (direction == Direction.BUY) {
                            assertThat(decision.getLiquidationPrice()).isLessThan(decision.getStopLossPrice());
                            assertThat(decision.getTakeProfitPrice()).isGreaterThan(entry);
                        } else {
                            assertThat(decision.getLiquidationPrice()).isGreaterThan(decision.getStopLossPrice());
                            assertThat(decision.getTakeProfitPrice()).isLessThan(entry);
                        }
                    }
                }
            }
        }
    }

    // ==============================
    // REJECTIONS
    // ==============================

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("A tripped breaker rejects before anything else is checked")
        void circuitBreakerFirst() {
            when(circuitBreaker.evaluate(any(AccountState.class))).thenReturn(CircuitBreakerState.TRIPPED_DAILY);
            SymbolStats noPrice = SymbolStats.builder().symbol("BTCUSDT").build();

            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.99), account("1000"), noPrice);

            assertThat(decision.isRejected()).isTrue();
            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.CIRCUIT_BREAKER_TRIPPED);
            assertThat(decision.getViolations()).hasSize(1);
        }

        @Test
        @DisplayName("An open position on the symbol hits the per-symbol cap")
        void symbolCap() {
            AccountState account = account("1000", Map.of("P-1", OpenExposure.of("BTCUSDT", new BigDecimal("50"))));

            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account, stats(0.01));

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.SYMBOL_POSITION_CAP);
        }

        @Test
        @DisplayName("Too many open positions hits the portfolio cap")
        void portfolioCap() {
            tradingProperties.getRisk().setMaxOpenPositions(1);
            AccountState account = account("1000", Map.of("P-1", OpenExposure.of("ETHUSDT", new BigDecimal("50"))));

            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account, stats(0.01));

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.PORTFOLIO_POSITION_CAP);
        }

        @Test
        @DisplayName("No usable market price is rejected")
        void invalidPrice() {
            SymbolStats stats = SymbolStats.builder()
                    .symbol("BTCUSDT")
                    .volatility(0.01)
                    .historicalWinRate(0.5)
                    .referencePrice(BigDecimal.ZERO)
                    .build();

            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account("1000"), stats);

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.INVALID_MARKET_PRICE);
        }

        @Test
        @DisplayName("Size beyond available margin is rejected")
        void insufficientMargin() {
            Map<String, OpenExposure> exposures = new LinkedHashMap<>();
            exposures.put("P-1", OpenExposure.of("ETHUSDT", new BigDecimal("500")));
            exposures.put("P-2", OpenExposure.of("SOLUSDT", new BigDecimal("450")));

            RiskDecision decision =
                    riskManager.evaluate(intent(Direction.BUY, 0.8), account("1000", exposures), stats(0.01));

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.INSUFFICIENT_MARGIN);
            assertThat(decision.getRejectionDetail()).contains("insufficient_margin");
        }

        @Test
        @DisplayName("Leverage above the exchange ceiling is rejected")
        void leverageCeiling() {
            SymbolStats stats = SymbolStats.builder()
                    .symbol("BTCUSDT")
                    .volatility(0.01)
                    .historicalWinRate(0.5)
                    .referencePrice(new BigDecimal("100"))
                    .maxLeverage(2)
                    .build();

            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account("1000"), stats);

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.LEVERAGE_CEILING_EXCEEDED);
        }

        @Test
        @DisplayName("Notional under the exchange minimum is rejected")
        void belowMinimumOrderSize() {
            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account("10"), stats(0.01));

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.BELOW_MIN_ORDER_SIZE);
        }

        @Test
        @DisplayName("No room for a stop before liquidation is rejected")
        void liquidationTooClose() {
            tradingProperties.getRisk().setMaintenanceMarginRate(0.2);

            RiskDecision decision = riskManager.evaluate(intent(Direction.BUY, 0.8), account("1000"), stats(0.0));

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.LIQUIDATION_TOO_CLOSE);
        }

        @Test
        @DisplayName("All violations are collected and the first is the reason")
        void collectsAllViolations() {
            Map<String, OpenExposure> exposures = new LinkedHashMap<>();
            exposures.put("P-1", OpenExposure.of("BTCUSDT", new BigDecimal("500")));
            exposures.put("P-2", OpenExposure.of("SOLUSDT", new BigDecimal("450")));

            RiskDecision decision =
                    riskManager.evaluate(intent(Direction.BUY, 0.8), account("1000", exposures), stats(0.01));

            assertThat(decision.getRejectionReason()).isEqualTo(RejectionReason.SYMBOL_POSITION_CAP);
            assertThat(decision.getViolations())
                    .extracting(RiskViolation::getReason)
                    .containsExactly(RejectionReason.SYMBOL_POSITION_CAP, RejectionReason.INSUFFICIENT_MARGIN);
        }
    }

    // ==============================
    // FORMULAS
    // ==============================

    @Nested
    @DisplayName("Formulas")
    class Formulas {

        @Test
        @DisplayName("Leverage falls with volatility and is clamped to [1, max]")
        void leverageClamped() {
            assertThat(riskManager.leverage(0.0)).isEqualTo(5);
            assertThat(riskManager.leverage(0.1)).isEqualTo(2);
            assertThat(riskManager.leverage(1.0)).isEqualTo(1);

            tradingProperties.getRisk().setBaseLeverage(50);
            assertThat(riskManager.leverage(0.0)).isEqualTo(10);
        }

        @Test
        @DisplayName("Confidence scalar is clamped to [0.5, 1.5]")
        void confidenceScalarClamped() {
            assertThat(riskManager.confidenceScalar(0.8)).isEqualTo(1.2);
            assertThat(riskManager.confidenceScalar(0.0)).isEqualTo(0.5);

            tradingProperties.getRisk().setConfidenceSensitivity(5.0);
            assertThat(riskManager.confidenceScalar(1.0)).isEqualTo(1.5);
        }

        @Test
        @DisplayName("Position size is capped at the max position fraction")
        void positionSizeCapped() {
            tradingProperties.getRisk().setMaxPositionFraction(0.1);

            assertThat(riskManager.positionSize(1.0, new BigDecimal("1000"))).isEqualByComparingTo("100");
            assertThat(riskManager.positionSize(1.0, BigDecimal.ZERO)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Win rate widens or narrows stop-loss and take-profit within bounds")
        void winRateScaling() {
            assertThat(riskManager.stopLossFraction(1.0, 0.245)).isEqualTo(0.03);
            assertThat(riskManager.stopLossFraction(0.0, 0.245)).isEqualTo(0.01);
            assertThat(riskManager.takeProfitFraction(1.0)).isEqualTo(0.075);
            assertThat(riskManager.takeProfitFraction(0.0)).isEqualTo(0.025);
        }

        @Test
        @DisplayName("Stop-loss is tightened to 80% of the liquidation distance")
        void stopLossTightened() {
            assertThat(riskManager.stopLossFraction(0.5, 0.02)).isEqualTo(0.016);
            assertThat(riskManager.liquidationFraction(10)).isEqualTo(0.095);
        }
    }

    // ==============================
    // FIXTURES
    // ==============================

    private static TradeIntent intent(Direction direction, double confidence) {
        return TradeIntent.builder()
                .symbol("BTCUSDT")
                .direction(direction)
                .aggregateConfidence(confidence)
                .contributingSignalCount(4)
                .timestamp(Instant.parse("2025-03-10T10:00:00Z"))
                .build();
    }

    private static AccountState account(String equity) {
        return account(equity, Map.of());
    }

    private static AccountState account(String equity, Map<String, OpenExposure> exposures) {
        return AccountState.initial(new BigDecimal(equity), TODAY).toBuilder()
                .openExposures(exposures)
                .build();
    }

    private static SymbolStats stats(double volatility) {
        return SymbolStats.builder()
                .symbol("BTCUSDT")
                .volatility(volatility)
                .historicalWinRate(0.5)
                .referencePrice(new BigDecimal("100"))
                .build();
    }
}
