package com.signaltrader.ledger;

import com.signaltrader.domain.enums.CircuitBreakerState;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.AccountState;
import com.signaltrader.domain.model.LedgerEntry;
import com.signaltrader.domain.model.OpenExposure;
import com.signaltrader.domain.model.Position;
import com.signaltrader.domain.model.Trade;
import com.signaltrader.domain.model.TradeIntent;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single writer of the live {@link AccountState}.
 *
 * <p>Every mutation is a ledger append followed by applying the stored entry through
 * {@link AccountStateReducer}, both under one lock. If the append throws, the state is
 * left untouched, so in-memory state never runs ahead of the ledger.
 *
 * <p>Reads are lock-free and see the last committed state rolled to the current trading day.
 *
 * <p>Margin reservations cover entries that are approved but not yet in the ledger: orders
 * in flight, and fills whose open record failed to write. They are held in memory only and
 * show up in {@link #currentWithReservations()} as extra open exposures, never in the
 * ledger-derived state.
 */
@Service
public class AccountStateService {

    private static final Logger log = LoggerFactory.getLogger(AccountStateService.class);

    private final TradeLedger tradeLedger;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<AccountState> state = new AtomicReference<>();
    private final Map<String, OpenExposure> reservations = new ConcurrentHashMap<>();

    public AccountStateService(TradeLedger tradeLedger, Clock clock) {
        this.tradeLedger = tradeLedger;
        this.clock = clock;
    }

    /** Rebuilds live state from a full ledger replay. */
    public AccountState reload() {
        writeLock.lock();
        try {
            AccountState replayed = tradeLedger.replay();
            state.set(replayed);
            log.info(
                    "Account state loaded from ledger: equity={}, open={}, dailyPnl={}, consecutiveLosses={}, seq={}",
                    replayed.getEquity(),
                    replayed.getOpenPositionCount(),
                    replayed.getDailyRealizedPnl(),
                    replayed.getConsecutiveLosses(),
                    replayed.getLastSequenceId());
            return replayed;
        } finally {
            writeLock.unlock();
        }
    }

    public AccountState current() {
        AccountState current = state.get();
        if (current == null) {
            current = reload();
        }
        return current.rollTo(LocalDate.now(clock));
    }

    /**
     * Live state with every margin reservation added as an open exposure. A reservation
     * whose id is already an open position in the ledger is not counted twice.
     */
    public AccountState currentWithReservations() {
        AccountState current = current();
        if (reservations.isEmpty()) {
            return current;
        }
        Map<String, OpenExposure> exposures = new LinkedHashMap<>(current.getOpenExposures());
        reservations.forEach(exposures::putIfAbsent);
        return current.toBuilder()
                .openExposures(Collections.unmodifiableMap(exposures))
                .build();
    }

    // ========================
    // MARGIN RESERVATIONS
    // ========================

    public void reserveMargin(String reservationId, String symbol, BigDecimal margin) {
        reservations.put(reservationId, OpenExposure.of(symbol, margin));
        log.debug("Reserved {} margin on {} ({})", margin.toPlainString(), symbol, reservationId);
    }

    public void releaseMargin(String reservationId) {
        if (reservations.remove(reservationId) != null) {
            log.debug("Released margin reservation {}", reservationId);
        }
    }

    public int getReservationCount() {
        return reservations.size();
    }

    // ========================
    // LEDGER-THEN-STATE WRITES
    // ========================

    public LedgerEntry recordPositionOpened(Position position) {
        return commit(() -> tradeLedger.appendPositionOpened(position));
    }

    /** Empty when the trade was already in the ledger; state is then left as is. */
    public Optional<LedgerEntry> recordTradeClosed(Trade trade) {
        writeLock.lock();
        try {
            ensureLoaded();
            Optional<LedgerEntry> entry = tradeLedger.appendTradeClosed(trade);
            entry.ifPresent(this::applyLocked);
            return entry;
        } finally {
            writeLock.unlock();
        }
    }

    public LedgerEntry recordRejection(TradeIntent intent, RejectionReason reason, String detail) {
        return commit(() -> tradeLedger.appendRejection(intent, reason, detail));
    }

    public LedgerEntry recordBreakerTrip(CircuitBreakerState breakerState, String reason) {
        return commit(() -> tradeLedger.appendBreakerTrip(breakerState, reason));
    }

    public LedgerEntry recordBreakerReset(String operator) {
        return commit(() -> tradeLedger.appendBreakerReset(operator));
    }

    private LedgerEntry commit(Supplier<LedgerEntry> append) {
        writeLock.lock();
        try {
            ensureLoaded();
            LedgerEntry entry = append.get();
            applyLocked(entry);
            return entry;
        } finally {
            writeLock.unlock();
        }
    }

    private void applyLocked(LedgerEntry entry) {
        state.set(AccountStateReducer.apply(state.get(), entry, clock.getZone()));
    }

    private void ensureLoaded() {
        if (state.get() == null) {
            state.set(tradeLedger.replay());
        }
    }
}
