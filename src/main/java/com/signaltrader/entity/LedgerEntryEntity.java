package com.signaltrader.entity;

import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.Direction;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.enums.LedgerEntryType;
import com.signaltrader.domain.enums.OrderSide;
import com.signaltrader.domain.enums.RejectionReason;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the ledger_entries table.
 *
 * <p>Rows are only ever inserted. The identity column is the ledger sequence and
 * defines replay order. One wide table holds every entry type; columns that do not
 * apply to a type stay null.
 */
@Entity
@Table(
        name = "ledger_entries",
        indexes = {
            @Index(name = "idx_ledger_type_position", columnList = "entry_type, position_id"),
            @Index(name = "idx_ledger_type_symbol", columnList = "entry_type, symbol")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, columnDefinition = "varchar(40)")
    private LedgerEntryType entryType;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "position_id", length = 36)
    private String positionId;

    @Column(name = "trade_id", length = 36)
    private String tradeId;

    @Column(length = 30)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Column(name = "entry_price", precision = 24, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "exit_price", precision = 24, scale = 8)
    private BigDecimal exitPrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal quantity;

    @Column(name = "position_size", precision = 24, scale = 8)
    private BigDecimal positionSize;

    @Column(precision = 10, scale = 2)
    private BigDecimal leverage;

    @Column(name = "stop_loss_price", precision = 24, scale = 8)
    private BigDecimal stopLossPrice;

    @Column(name = "take_profit_price", precision = 24, scale = 8)
    private BigDecimal takeProfitPrice;

    @Column(name = "liquidation_price", precision = 24, scale = 8)
    private BigDecimal liquidationPrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal fees;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "exit_reason", columnDefinition = "varchar(30)")
    private ExitReason exitReason;

    @Column(name = "order_id", length = 64)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private Direction direction;

    @Column(name = "aggregate_confidence")
    private Double aggregateConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_reason", columnDefinition = "varchar(40)")
    private RejectionReason rejectionReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "breaker_state", columnDefinition = "varchar(20)")
    private CircuitBreakerState breakerState;

    @Column(length = 500)
    private String detail;
}
