package com.signaltrader.pnl;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Leveraged PnL and fee arithmetic for perpetual positions.
 *
 * <ul>
 *   <li><b>Gross PnL:</b> (exit - entry) * quantity for a long, mirrored for a short. With
 *       quantity = collateral * leverage / entry this equals move% * collateral * leverage.</li>
 *   <li><b>Fee:</b> price * quantity * taker rate, charged on entry and exit fills.</li>
 *   <li><b>Liquidation:</b> the whole collateral is lost, plus the entry fee already paid.</li>
 * </ul>
 *
 * <p>All amounts are rounded to {@value #SCALE} decimals.
 */
@Component
public class PnLCalculator {

    public static final int SCALE = 8;

    private final TradingProperties tradingProperties;

    public PnLCalculator(TradingProperties tradingProperties) {
        this.tradingProperties = tradingProperties;
    }

    public BigDecimal grossPnl(OrderSide side, BigDecimal entryPrice, BigDecimal exitPrice, BigDecimal quantity) {
        BigDecimal move = exitPrice.subtract(entryPrice);
        if (!side.isLong()) {
            move = move.negate();
        }
        return move.multiply(quantity).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal takerFee(BigDecimal price, BigDecimal quantity) {
        return price.multiply(quantity)
                .multiply(tradingProperties.getExecution().getTakerFeeRate())
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** Net PnL of closing {@code position} at {@code exitPrice}, after entry and exit fees. */
    public BigDecimal realizedPnl(Position position, BigDecimal exitPrice, BigDecimal exitFee) {
        return grossPnl(position.getSide(), position.getEntryPrice(), exitPrice, position.getQuantity())
                .subtract(nullToZero(position.getEntryFee()))
                .subtract(exitFee)
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal liquidationPnl(Position position) {
        return position.getPositionSize()
                .add(nullToZero(position.getEntryFee()))
                .negate()
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** Unrealized PnL at {@code markPrice}, before exit fees. */
    public BigDecimal unrealizedPnl(Position position, BigDecimal markPrice) {
        return grossPnl(position.getSide(), position.getEntryPrice(), markPrice, position.getQuantity());
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
