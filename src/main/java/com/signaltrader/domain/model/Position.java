package com.signaltrader.domain.model;

import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A leveraged position opened from a filled entry order.
 *
 * <p>{@code positionSize} is the collateral (margin) committed; notional exposure is
 * {@code positionSize * leverage} and {@code quantity} is the filled base-asset amount.
 * For a long, stopLoss and liquidation sit below entry and takeProfit above; for a short
 * the relation is mirrored. The stop-loss is always strictly nearer to entry than the
 * liquidation price.
 *
 * <p>Mutated only by the position lifecycle manager, under its per-position lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private OrderSide side;
    private BigDecimal entryPrice;
    private BigDecimal quantity;
    private BigDecimal positionSize;
    private BigDecimal leverage;
    private BigDecimal stopLossPrice;
    private BigDecimal takeProfitPrice;
    private BigDecimal liquidationPrice;
    private BigDecimal entryFee;
    private String entryOrderId;
    private Instant openedAt;

    private PositionStatus status;
    private Instant closedAt;
    private BigDecimal exitPrice;
    private ExitReason exitReason;
    private BigDecimal realizedPnl;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public BigDecimal getNotional() {
        return positionSize.multiply(leverage);
    }
}
