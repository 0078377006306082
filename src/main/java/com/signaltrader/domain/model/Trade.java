package com.signaltrader.domain.model;

import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable record of a closed or liquidated position. Exactly one trade exists per
 * terminal position; {@code realizedPnl} is net of {@code fees}.
 */
@Value
@Builder
public class Trade {

    String id;
    String positionId;
    String symbol;
    OrderSide side;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal quantity;
    BigDecimal positionSize;
    BigDecimal leverage;
    BigDecimal fees;
    BigDecimal realizedPnl;
    Instant openedAt;
    Instant closedAt;
    ExitReason exitReason;

    public boolean isWin() {
        return realizedPnl.signum() > 0;
    }
}
