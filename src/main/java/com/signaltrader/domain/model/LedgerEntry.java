package com.signaltrader.domain.model;

import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.enums.LedgerEntryType;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.RejectionReason;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One append-only ledger record. The sequence id is assigned by storage and is
 * strictly increasing; fields not relevant to the entry type are null.
 */
@Value
@Builder
public class LedgerEntry {

    Long sequenceId;
    LedgerEntryType entryType;
    Instant recordedAt;

    // position and trade fields
    String positionId;
    String tradeId;
    String symbol;
    OrderSide side;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal quantity;
    BigDecimal positionSize;
    BigDecimal leverage;
    BigDecimal stopLossPrice;
    BigDecimal takeProfitPrice;
    BigDecimal liquidationPrice;
    BigDecimal fees;
    BigDecimal realizedPnl;
    Instant openedAt;
    Instant closedAt;
    ExitReason exitReason;
    String orderId;

    // rejection fields
    Direction direction;
    Double aggregateConfidence;
    RejectionReason rejectionReason;

    // circuit breaker fields
    CircuitBreakerState breakerState;

    String detail;
}
