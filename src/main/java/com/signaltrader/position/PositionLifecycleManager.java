package com.signaltrader.position;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.enums.ExitReason;
import com.signaltrader.domain.enums.PositionStatus;
import com.signaltrader.domain.model.ExecutionResult;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.event.TradingEventPublisher;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exception.LedgerWriteException;
import com.signaltrader.exception.ResourceNotFoundException;
import com.signaltrader.exchange.ClosePositionResult;
import com.signaltrader.exchange.ExchangeAdapter;
import com.signaltrader.ledger.AccountStateService;
import com.signaltrader.pnl.PnLCalculator;
import com.signaltrader.risk.RiskDecision;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns every {@link Position} from fill to close.
 *
 * <p>Exit checks, in priority order for a long (mirrored for a short):
 * <ol>
 *   <li>LIQUIDATION: mark at or beyond the liquidation price. The exchange is asked whether it
 *       still holds the position. If it does not, the position was liquidated: no order is
 *       sent and the whole collateral is lost. If it does, the local estimate ran ahead of the
 *       exchange and the position is closed at market as a STOP_LOSS.</li>
 *   <li>STOP_LOSS: mark at or below the stop-loss price.</li>
 *   <li>TAKE_PROFIT: mark at or above the take-profit price.</li>
 *   <li>MAX_HOLDING_TIME: open longer than the configured maximum holding time.</li>
 * </ol>
 *
 * <p>State changes go ledger first, memory second. If the exchange close fails the position
 * stays OPEN and is checked again on the next tick. If the close succeeded but the trade
 * could not be written, the trade is kept as pending and only the ledger write is retried;
 * the exchange is never asked to close the same position twice.
 *
 * <p>All work on one position happens under that position's lock, so concurrent exit checks
 * produce at most one trade. Closed positions leave the live map and stay visible through a
 * bounded view of recent closes.
 *
 * <p>A filled entry whose open record could not be written holds a margin reservation in
 * {@link AccountStateService} until the record is written.
 */
@Service
public class PositionLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(PositionLifecycleManager.class);

    private static final int SCALE = 8;
    private static final int RECENTLY_CLOSED_LIMIT = 500;

    private final ExchangeAdapter exchangeAdapter;
    private final AccountStateService accountStateService;
    private final PnLCalculator pnLCalculator;
    private final TradingEventPublisher tradingEventPublisher;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Cache<String, Position> recentlyClosed =
            Caffeine.newBuilder().maximumSize(RECENTLY_CLOSED_LIMIT).build();

    /** Filled entries whose POSITION_OPENED write failed. */
    private final Map<String, Position> pendingOpens = new ConcurrentHashMap<>();

    /** Completed closes whose TRADE_CLOSED write failed. */
    private final Map<String, Trade> pendingExits = new ConcurrentHashMap<>();

    public PositionLifecycleManager(
            ExchangeAdapter exchangeAdapter,
            AccountStateService accountStateService,
            PnLCalculator pnLCalculator,
            TradingEventPublisher tradingEventPublisher,
            TradingProperties tradingProperties,
            Clock clock) {
        this.exchangeAdapter = exchangeAdapter;
        this.accountStateService = accountStateService;
        this.pnLCalculator = pnLCalculator;
        this.tradingEventPublisher = tradingEventPublisher;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    // ========================
    // OPEN
    // ========================

    /**
     * Opens a position from a filled entry order. Exit prices are moved onto the actual fill
     * price at the same relative distances the risk manager chose, and collateral is scaled
     * to the filled quantity.
     *
     * <p>The position is tracked even if the ledger write fails, since the exchange already
     * holds it; the write is retried on the next monitor tick.
     */
    public Position openPosition(RiskDecision decision, ExecutionResult result) {
        BigDecimal fillPrice = result.getFilledPrice();
        BigDecimal hint = decision.getEntryPriceHint();
        BigDecimal filledShare =
                result.getFilledQuantity().divide(result.getRequestedQuantity(), SCALE, RoundingMode.DOWN);

        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .symbol(decision.getSymbol())
                .side(decision.getSide())
                .entryPrice(fillPrice)
                .quantity(result.getFilledQuantity())
                .positionSize(decision.getPositionSize().multiply(filledShare).setScale(SCALE, RoundingMode.DOWN))
                .leverage(decision.getLeverage())
                .stopLossPrice(rebase(decision.getStopLossPrice(), hint, fillPrice))
                .takeProfitPrice(rebase(decision.getTakeProfitPrice(), hint, fillPrice))
                .liquidationPrice(rebase(decision.getLiquidationPrice(), hint, fillPrice))
                .entryFee(result.getFee())
                .entryOrderId(result.getOrderId())
                .openedAt(clock.instant())
                .status(PositionStatus.OPEN)
                .build();

        try {
            accountStateService.recordPositionOpened(position);
        } catch (LedgerWriteException e) {
            log.error(
                    "Position {} on {} filled but not recorded, will retry: {}",
                    position.getId(),
                    position.getSymbol(),
                    e.getMessage());
            pendingOpens.put(position.getId(), position);
            accountStateService.reserveMargin(position.getId(), position.getSymbol(), position.getPositionSize());
        }
        positions.put(position.getId(), position);

        log.info(
                "Position {} opened: {} {} qty={} @ {} lev={}x SL={} TP={} liq={}",
                position.getId(),
                position.getSide(),
                position.getSymbol(),
                position.getQuantity().toPlainString(),
                fillPrice.toPlainString(),
                position.getLeverage().toPlainString(),
                position.getStopLossPrice().toPlainString(),
                position.getTakeProfitPrice().toPlainString(),
                position.getLiquidationPrice().toPlainString());
        tradingEventPublisher.publishTradeOpened(this, position);
        return position;
    }

    /** Re-registers open positions rebuilt from the ledger after a restart. */
    public void restore(List<Position> openPositions) {
        for (Position position : openPositions) {
            positions.put(position.getId(), position);
        }
        log.info("Restored {} open position(s) from ledger", openPositions.size());
    }

    // ========================
    // EXIT CHECKS
    // ========================

    /**
     * Checks the exit conditions of one position at {@code markPrice} and closes it if any
     * fires. Calling this again after a close is a no-op.
     */
    public Optional<Trade> evaluateExit(String positionId, BigDecimal markPrice) {
        if (!isTracked(positionId)) {
            return Optional.empty();
        }
        ReentrantLock lock = lockFor(positionId);
        lock.lock();
        try {
            if (hasPendingWrites(positionId)) {
                return retryPendingLocked(positionId);
            }
            Position position = positions.get(positionId);
            if (position == null || !position.isOpen()) {
                return Optional.empty();
            }
            ExitReason reason = exitReason(position, markPrice, clock.instant());
            if (reason == null) {
                return Optional.empty();
            }
            log.info(
                    "Exit {} triggered for {} {} at mark {}",
                    reason,
                    position.getSymbol(),
                    positionId,
                    markPrice.toPlainString());
            return closeLocked(position, reason);
        } finally {
            lock.unlock();
        }
    }

    /** Exit reason firing for {@code position} at {@code markPrice}, or null. */
    public ExitReason exitReason(Position position, BigDecimal markPrice, Instant now) {
        boolean isLong = position.getSide().isLong();
        if (crossed(markPrice, position.getLiquidationPrice(), isLong)) {
            return ExitReason.LIQUIDATION;
        }
        if (crossed(markPrice, position.getStopLossPrice(), isLong)) {
            return ExitReason.STOP_LOSS;
        }
        if (crossed(markPrice, position.getTakeProfitPrice(), !isLong)) {
            return ExitReason.TAKE_PROFIT;
        }
        Duration maxHolding = tradingProperties.getPositions().getMaxHoldingTime();
        if (maxHolding != null && !Duration.between(position.getOpenedAt(), now).minus(maxHolding).isNegative()) {
            return ExitReason.MAX_HOLDING_TIME;
        }
        return null;
    }

    // ========================
    // EXPLICIT CLOSE
    // ========================

    /**
     * Closes an open position for an operator request or a signal reversal.
     *
     * @return the trade, or empty when the close failed or its write is pending
     * @throws ResourceNotFoundException if no such position is tracked
     */
    public Optional<Trade> closePosition(String positionId, ExitReason reason) {
        if (!isTracked(positionId)) {
            if (recentlyClosed.getIfPresent(positionId) != null) {
                return Optional.empty();
            }
            throw new ResourceNotFoundException("Position", positionId);
        }
        ReentrantLock lock = lockFor(positionId);
        lock.lock();
        try {
            if (hasPendingWrites(positionId)) {
                return retryPendingLocked(positionId);
            }
            Position position = positions.get(positionId);
            if (position == null || !position.isOpen()) {
                return Optional.empty();
            }
            log.info("Closing {} {} ({})", position.getSymbol(), positionId, reason);
            return closeLocked(position, reason);
        } finally {
            lock.unlock();
        }
    }

    /** Retries every ledger write left over from earlier failures. Returns the trades now recorded. */
    public List<Trade> retryPendingLedgerWrites() {
        Set<String> ids = new LinkedHashSet<>(pendingOpens.keySet());
        ids.addAll(pendingExits.keySet());

        List<Trade> recorded = new ArrayList<>();
        for (String id : ids) {
            if (!isTracked(id)) {
                continue;
            }
            ReentrantLock lock = lockFor(id);
            lock.lock();
            try {
                retryPendingLocked(id).ifPresent(recorded::add);
            } finally {
                lock.unlock();
            }
        }
        return recorded;
    }

    // ========================
    // QUERIES
    // ========================

    public List<Position> getOpenPositions() {
        return positions.values().stream()
                .filter(Position::isOpen)
                .sorted(Comparator.comparing(Position::getOpenedAt))
                .toList();
    }

    public Optional<Position> findOpenPosition(String symbol) {
        return getOpenPositions().stream()
                .filter(p -> p.getSymbol().equals(symbol))
                .findFirst();
    }

    /** A tracked position, or one among the recent closes. */
    public Optional<Position> getPosition(String positionId) {
        Position position = positions.get(positionId);
        return position != null
                ? Optional.of(position)
                : Optional.ofNullable(recentlyClosed.getIfPresent(positionId));
    }

    public int getTrackedPositionCount() {
        return positions.size();
    }

    public boolean hasPendingWrites(String positionId) {
        return pendingOpens.containsKey(positionId) || pendingExits.containsKey(positionId);
    }

    public int getPendingWriteCount() {
        return pendingOpens.size() + pendingExits.size();
    }

    // ========================
    // INTERNALS
    // ========================

    private Optional<Trade> closeLocked(Position position, ExitReason triggered) {
        ExitReason reason = triggered;
        if (reason == ExitReason.LIQUIDATION) {
            boolean heldByExchange;
            try {
                heldByExchange = exchangeAdapter.hasOpenPosition(position);
            } catch (ExchangeException e) {
                String message = "Liquidation check of " + position.getSymbol() + " " + position.getId()
                        + " failed, position stays open: " + e.getMessage();
                log.error(message);
                tradingEventPublisher.publishExecutionError(this, position.getSymbol(), null, message);
                return Optional.empty();
            }
            if (heldByExchange) {
                log.warn(
                        "Position {} on {} is past its liquidation estimate but still held by the exchange, "
                                + "closing at market",
                        position.getId(),
                        position.getSymbol());
                reason = ExitReason.STOP_LOSS;
            }
        }

        Instant closedAt = clock.instant();
        BigDecimal exitPrice;
        BigDecimal exitFee;
        BigDecimal realizedPnl;
        PositionStatus status;

        if (reason == ExitReason.LIQUIDATION) {
            exitPrice = position.getLiquidationPrice();
            exitFee = BigDecimal.ZERO;
            realizedPnl = pnLCalculator.liquidationPnl(position);
            status = PositionStatus.LIQUIDATED;
        } else {
            ClosePositionResult closeResult;
            try {
                closeResult = exchangeAdapter.closePosition(position);
            } catch (ExchangeException e) {
                String message = "Close of " + position.getSymbol() + " " + position.getId() + " (" + reason
                        + ") failed, position stays open: " + e.getMessage();
                log.error(message);
                tradingEventPublisher.publishExecutionError(this, position.getSymbol(), null, message);
                return Optional.empty();
            }
            exitPrice = closeResult.getExitPrice();
            exitFee = closeResult.getFee() != null
                    ? closeResult.getFee()
                    : pnLCalculator.takerFee(exitPrice, position.getQuantity());
            realizedPnl = pnLCalculator.realizedPnl(position, exitPrice, exitFee);
            status = PositionStatus.CLOSED;
        }

        BigDecimal entryFee = position.getEntryFee() != null ? position.getEntryFee() : BigDecimal.ZERO;
        Trade trade = Trade.builder()
                .id(UUID.randomUUID().toString())
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .entryPrice(position.getEntryPrice())
                .exitPrice(exitPrice)
                .quantity(position.getQuantity())
                .positionSize(position.getPositionSize())
                .leverage(position.getLeverage())
                .fees(entryFee.add(exitFee).setScale(SCALE, RoundingMode.HALF_UP))
                .realizedPnl(realizedPnl)
                .openedAt(position.getOpenedAt())
                .closedAt(closedAt)
                .exitReason(reason)
                .build();

        pendingExits.put(position.getId(), trade);
        if (status == PositionStatus.LIQUIDATED) {
            log.error(
                    "Position {} on {} LIQUIDATED at {}",
                    position.getId(),
                    position.getSymbol(),
                    exitPrice.toPlainString());
        }
        return retryPendingLocked(position.getId());
    }

    /** Writes whatever is pending for one position, open entry first. Caller holds the lock. */
    private Optional<Trade> retryPendingLocked(String positionId) {
        Position pendingOpen = pendingOpens.get(positionId);
        if (pendingOpen != null) {
            try {
                accountStateService.recordPositionOpened(pendingOpen);
                pendingOpens.remove(positionId);
                accountStateService.releaseMargin(positionId);
                log.info("Recorded pending open of position {}", positionId);
            } catch (LedgerWriteException e) {
                log.error("Ledger still unavailable for open of {}: {}", positionId, e.getMessage());
                return Optional.empty();
            }
        }

        Trade trade = pendingExits.get(positionId);
        if (trade == null) {
            return Optional.empty();
        }
        try {
            accountStateService.recordTradeClosed(trade);
        } catch (LedgerWriteException e) {
            log.error(
                    "Position {} closed on exchange but trade not recorded, will retry: {}",
                    positionId,
                    e.getMessage());
            return Optional.empty();
        }
        pendingExits.remove(positionId);
        applyClose(trade);
        tradingEventPublisher.publishTradeClosed(this, trade);
        return Optional.of(trade);
    }

    /** Marks the position closed and moves it to the recent-closes view. Caller holds the lock. */
    private void applyClose(Trade trade) {
        Position position = positions.remove(trade.getPositionId());
        locks.remove(trade.getPositionId());
        if (position == null) {
            return;
        }
        recentlyClosed.put(position.getId(), position);
        position.setStatus(
                trade.getExitReason() == ExitReason.LIQUIDATION ? PositionStatus.LIQUIDATED : PositionStatus.CLOSED);
        position.setExitPrice(trade.getExitPrice());
        position.setExitReason(trade.getExitReason());
        position.setRealizedPnl(trade.getRealizedPnl());
        position.setClosedAt(trade.getClosedAt());
        log.info(
                "Position {} {} on {}: exit {} pnl {}",
                position.getId(),
                position.getStatus(),
                position.getSymbol(),
                trade.getExitPrice().toPlainString(),
                trade.getRealizedPnl().toPlainString());
    }

    private boolean isTracked(String positionId) {
        return positions.containsKey(positionId) || hasPendingWrites(positionId);
    }

    private ReentrantLock lockFor(String positionId) {
        return locks.computeIfAbsent(positionId, id -> new ReentrantLock());
    }

    /** True when mark is at or below {@code level}, or at or above it when {@code below} is false. */
    private static boolean crossed(BigDecimal mark, BigDecimal level, boolean below) {
        if (level == null) {
            return false;
        }
        int cmp = mark.compareTo(level);
        return below ? cmp <= 0 : cmp >= 0;
    }

    private static BigDecimal rebase(BigDecimal level, BigDecimal hint, BigDecimal fillPrice) {
        return fillPrice.multiply(level).divide(hint, SCALE, RoundingMode.HALF_UP);
    }
}
