package com.signaltrader.engine;

import com.signaltrader.config.TradingProperties;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Runs one decision cycle per configured symbol at a fixed delay.
 *
 * <p>Each symbol has its own scheduled task, so a slow or failing symbol never blocks the
 * others, and fixed delay keeps cycles of one symbol from overlapping. Every exception a
 * cycle throws is caught and logged here; the task keeps its schedule.
 *
 * <p>Started by startup recovery once the ledger has been replayed, not on context refresh.
 */
@Component
public class TradingCycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(TradingCycleScheduler.class);

    private final DecisionCycleService decisionCycleService;
    private final TaskScheduler taskScheduler;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TradingCycleScheduler(
            DecisionCycleService decisionCycleService,
            @Qualifier("taskScheduler") TaskScheduler taskScheduler,
            TradingProperties tradingProperties,
            Clock clock) {
        this.decisionCycleService = decisionCycleService;
        this.taskScheduler = taskScheduler;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    /** Schedules every configured symbol. Symbols already scheduled are left alone. */
    public synchronized void start() {
        TradingProperties.Cycle cycle = tradingProperties.getCycle();
        if (!cycle.isEnabled()) {
            log.info("Decision cycles disabled by configuration");
            return;
        }
        for (String symbol : tradingProperties.getSymbols()) {
            tasks.computeIfAbsent(symbol, s -> taskScheduler.scheduleWithFixedDelay(
                    () -> runSafely(s), clock.instant().plus(cycle.getInitialDelay()), cycle.getInterval()));
        }
        log.info("Decision cycles scheduled for {} every {}", tasks.keySet(), cycle.getInterval());
    }

    public synchronized void stop() {
        tasks.values().forEach(task -> task.cancel(false));
        log.info("Decision cycles stopped for {}", tasks.keySet());
        tasks.clear();
    }

    public List<String> getScheduledSymbols() {
        return List.copyOf(tasks.keySet());
    }

    public boolean isRunning() {
        return !tasks.isEmpty();
    }

    /** One cycle for {@code symbol}; never throws. */
    void runSafely(String symbol) {
        try {
            CycleResult result = decisionCycleService.runCycle(symbol);
            log.debug("Cycle {} -> {} {}", symbol, result.getOutcome(), Objects.toString(result.getDetail(), ""));
        } catch (Exception e) {
            log.error("Decision cycle for {} failed: {}", symbol, e.getMessage(), e);
        }
    }
}
