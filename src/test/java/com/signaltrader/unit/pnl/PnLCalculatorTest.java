package com.signaltrader.unit.pnl;

import static org.assertj.core.api.Assertions.assertThat;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.model.Position;
import com.signaltrader.pnl.PnLCalculator;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PnLCalculatorTest {

    private final PnLCalculator pnlCalculator = new PnLCalculator(new TradingProperties());

    private static Position position(OrderSide side) {
        return Position.builder()
                .id("P-1")
                .symbol("BTCUSDT")
                .side(side)
                .entryPrice(new BigDecimal("100"))
                .quantity(new BigDecimal("4.8"))
                .positionSize(new BigDecimal("120"))
                .leverage(new BigDecimal("4"))
                .entryFee(new BigDecimal("0.24"))
                .build();
    }

    @Test
    void grossPnl_longGainsOnRise() {
        assertThat(pnlCalculator.grossPnl(
                        OrderSide.BUY, new BigDecimal("100"), new BigDecimal("105"), new BigDecimal("4.8")))
                .isEqualByComparingTo("24");
    }

    @Test
    void grossPnl_shortIsMirrored() {
        assertThat(pnlCalculator.grossPnl(
                        OrderSide.SELL, new BigDecimal("100"), new BigDecimal("105"), new BigDecimal("4.8")))
                .isEqualByComparingTo("-24");
    }

    @Test
    void grossPnl_equalsMoveTimesCollateralTimesLeverage() {
        // 5% move on 120 collateral at 4x
        BigDecimal gross = pnlCalculator.grossPnl(
                OrderSide.BUY, new BigDecimal("100"), new BigDecimal("105"), new BigDecimal("4.8"));

        assertThat(gross).isEqualByComparingTo(new BigDecimal("0.05").multiply(new BigDecimal("480")));
    }

    @Test
    void takerFee_isNotionalTimesRate() {
        assertThat(pnlCalculator.takerFee(new BigDecimal("100"), new BigDecimal("4.8")))
                .isEqualByComparingTo("0.24");
    }

    @Test
    void realizedPnl_deductsEntryAndExitFees() {
        BigDecimal exitFee = pnlCalculator.takerFee(new BigDecimal("105"), new BigDecimal("4.8"));

        assertThat(exitFee).isEqualByComparingTo("0.252");
        assertThat(pnlCalculator.realizedPnl(position(OrderSide.BUY), new BigDecimal("105"), exitFee))
                .isEqualByComparingTo("23.508");
    }

    @Test
    void liquidationPnl_losesCollateralAndEntryFee() {
        assertThat(pnlCalculator.liquidationPnl(position(OrderSide.BUY))).isEqualByComparingTo("-120.24");
    }

    @Test
    void unrealizedPnl_shortAtLowerMark() {
        assertThat(pnlCalculator.unrealizedPnl(position(OrderSide.SELL), new BigDecimal("98")))
                .isEqualByComparingTo("9.6");
    }
}
