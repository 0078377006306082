package com.signaltrader.ledger;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.LedgerEntryType;
import com.signaltrader.domain.enums.PositionStatus;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.LedgerEntry;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.domain.model.TradeIntent;
import com.signaltrader.entity.LedgerEntryEntity;
import com.signaltrader.exception.LedgerWriteException;
import com.signaltrader.mapper.LedgerEntryMapper;
import com.signaltrader.repository.jpa.LedgerEntryJpaRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Append-only, durable record of positions, trades, rejected intents and circuit
 * breaker transitions. Source of truth for account state on restart.
 *
 * <p>Every append either returns the stored entry with its sequence id or throws
 * {@link LedgerWriteException}; callers must not update in-memory state on failure.
 * Nothing is ever updated or deleted.
 */
@Service
public class TradeLedger {

    private static final Logger log = LoggerFactory.getLogger(TradeLedger.class);

    private final LedgerEntryJpaRepository ledgerEntryJpaRepository;
    private final LedgerEntryMapper ledgerEntryMapper;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public TradeLedger(
            LedgerEntryJpaRepository ledgerEntryJpaRepository,
            LedgerEntryMapper ledgerEntryMapper,
            TradingProperties tradingProperties,
            Clock clock) {
        this.ledgerEntryJpaRepository = ledgerEntryJpaRepository;
        this.ledgerEntryMapper = ledgerEntryMapper;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    // ========================
    // APPEND
    // ========================

    public LedgerEntry appendPositionOpened(Position position) {
        return append(LedgerEntry.builder()
                .entryType(LedgerEntryType.POSITION_OPENED)
                .recordedAt(clock.instant())
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .entryPrice(position.getEntryPrice())
                .quantity(position.getQuantity())
                .positionSize(position.getPositionSize())
                .leverage(position.getLeverage())
                .stopLossPrice(position.getStopLossPrice())
                .takeProfitPrice(position.getTakeProfitPrice())
                .liquidationPrice(position.getLiquidationPrice())
                .fees(position.getEntryFee())
                .openedAt(position.getOpenedAt())
                .orderId(position.getEntryOrderId())
                .build());
    }

    /**
     * Records the trade for a terminal position. Returns empty when a trade for the same
     * position is already in the ledger, so a retried write never produces a second trade.
     */
    public Optional<LedgerEntry> appendTradeClosed(Trade trade) {
        if (exists(LedgerEntryType.TRADE_CLOSED, trade.getPositionId())) {
            log.warn("Trade for position {} already recorded, skipping duplicate", trade.getPositionId());
            return Optional.empty();
        }
        return Optional.of(append(LedgerEntry.builder()
                .entryType(LedgerEntryType.TRADE_CLOSED)
                .recordedAt(clock.instant())
                .positionId(trade.getPositionId())
                .tradeId(trade.getId())
                .symbol(trade.getSymbol())
                .side(trade.getSide())
                .entryPrice(trade.getEntryPrice())
                .exitPrice(trade.getExitPrice())
                .quantity(trade.getQuantity())
                .positionSize(trade.getPositionSize())
                .leverage(trade.getLeverage())
                .fees(trade.getFees())
                .realizedPnl(trade.getRealizedPnl())
                .openedAt(trade.getOpenedAt())
                .closedAt(trade.getClosedAt())
                .exitReason(trade.getExitReason())
                .build()));
    }

    public LedgerEntry appendRejection(TradeIntent intent, RejectionReason reason, String detail) {
        return append(LedgerEntry.builder()
                .entryType(LedgerEntryType.INTENT_REJECTED)
                .recordedAt(clock.instant())
                .symbol(intent.getSymbol())
                .direction(intent.getDirection())
                .aggregateConfidence(intent.getAggregateConfidence())
                .rejectionReason(reason)
                .detail(truncate(detail))
                .build());
    }

    public LedgerEntry appendBreakerTrip(CircuitBreakerState state, String reason) {
        return append(LedgerEntry.builder()
                .entryType(LedgerEntryType.CIRCUIT_BREAKER_TRIPPED)
                .recordedAt(clock.instant())
                .breakerState(state)
                .detail(truncate(reason))
                .build());
    }

    public LedgerEntry appendBreakerReset(String operator) {
        return append(LedgerEntry.builder()
                .entryType(LedgerEntryType.CIRCUIT_BREAKER_RESET)
                .recordedAt(clock.instant())
                .breakerState(CircuitBreakerState.ARMED)
                .detail(truncate("reset by " + operator))
                .build());
    }

    // ========================
    // READ / REPLAY
    // ========================

    public List<LedgerEntry> entries() {
        return ledgerEntryMapper.toDomainList(ledgerEntryJpaRepository.findAllByOrderByIdAsc());
    }

    /** Folds every entry, oldest first, from the configured initial equity. */
    public AccountState replay() {
        AccountState initial = AccountState.initial(tradingProperties.getAccount().getInitialEquity(), null);
        AccountState state = AccountStateReducer.replay(initial, entries(), clock.getZone());
        return state.rollTo(LocalDate.now(clock));
    }

    public List<Trade> closedTrades() {
        return toTrades(ledgerEntryJpaRepository.findByEntryTypeOrderByIdAsc(LedgerEntryType.TRADE_CLOSED));
    }

    public List<Trade> closedTrades(String symbol) {
        return toTrades(
                ledgerEntryJpaRepository.findByEntryTypeAndSymbolOrderByIdAsc(LedgerEntryType.TRADE_CLOSED, symbol));
    }

    /** Positions that have an open entry and no closing trade. */
    public List<Position> openPositions() {
        List<LedgerEntry> entries = entries();
        Set<String> closed = entries.stream()
                .filter(e -> e.getEntryType() == LedgerEntryType.TRADE_CLOSED)
                .map(LedgerEntry::getPositionId)
                .collect(Collectors.toSet());

        Map<String, Position> open = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            if (entry.getEntryType() == LedgerEntryType.POSITION_OPENED && !closed.contains(entry.getPositionId())) {
                open.put(entry.getPositionId(), toPosition(entry));
            }
        }
        return List.copyOf(open.values());
    }

    public long rejectionCount() {
        return ledgerEntryJpaRepository
                .findByEntryTypeOrderByIdAsc(LedgerEntryType.INTENT_REJECTED)
                .size();
    }

    // ========================
    // INTERNALS
    // ========================

    private LedgerEntry append(LedgerEntry entry) {
        try {
            LedgerEntryEntity saved = ledgerEntryJpaRepository.save(ledgerEntryMapper.toEntity(entry));
            LedgerEntry stored = ledgerEntryMapper.toDomain(saved);
            log.debug("Ledger #{} {} {}", stored.getSequenceId(), stored.getEntryType(), describe(stored));
            return stored;
        } catch (DataAccessException e) {
            throw new LedgerWriteException(
                    "Failed to append " + entry.getEntryType() + " for " + describe(entry) + ": " + e.getMessage(), e);
        }
    }

    private boolean exists(LedgerEntryType type, String positionId) {
        try {
            return ledgerEntryJpaRepository.existsByEntryTypeAndPositionId(type, positionId);
        } catch (DataAccessException e) {
            throw new LedgerWriteException("Failed to check ledger for position " + positionId, e);
        }
    }

    private List<Trade> toTrades(List<LedgerEntryEntity> entities) {
        return ledgerEntryMapper.toDomainList(entities).stream()
                .map(TradeLedger::toTrade)
                .toList();
    }

    static Trade toTrade(LedgerEntry entry) {
        return Trade.builder()
                .id(entry.getTradeId())
                .positionId(entry.getPositionId())
                .symbol(entry.getSymbol())
                .side(entry.getSide())
                .entryPrice(entry.getEntryPrice())
                .exitPrice(entry.getExitPrice())
                .quantity(entry.getQuantity())
                .positionSize(entry.getPositionSize())
                .leverage(entry.getLeverage())
                .fees(entry.getFees())
                .realizedPnl(entry.getRealizedPnl())
                .openedAt(entry.getOpenedAt())
                .closedAt(entry.getClosedAt())
                .exitReason(entry.getExitReason())
                .build();
    }

    static Position toPosition(LedgerEntry entry) {
        return Position.builder()
                .id(entry.getPositionId())
                .symbol(entry.getSymbol())
                .side(entry.getSide())
                .entryPrice(entry.getEntryPrice())
                .quantity(entry.getQuantity())
                .positionSize(entry.getPositionSize())
                .leverage(entry.getLeverage())
                .stopLossPrice(entry.getStopLossPrice())
                .takeProfitPrice(entry.getTakeProfitPrice())
                .liquidationPrice(entry.getLiquidationPrice())
                .entryFee(entry.getFees())
                .entryOrderId(entry.getOrderId())
                .openedAt(entry.getOpenedAt())
                .status(PositionStatus.OPEN)
                .build();
    }

    private static String describe(LedgerEntry entry) {
        if (entry.getPositionId() != null) {
            return entry.getSymbol() + "/" + entry.getPositionId();
        }
        if (entry.getSymbol() != null) {
            return entry.getSymbol();
        }
        return String.valueOf(entry.getBreakerState());
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= 500) {
            return text;
        }
        return text.substring(0, 500);
    }
}
