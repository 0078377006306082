package com.signaltrader.signal;

import com.signaltrader.config.TradingProperties;
import com.signaltrader.domain.model.MarketContext;
import com.signaltrader.domain.model.Signal;
import com.signaltrader.domain.model.SignalScore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Queries every registered signal source concurrently for one symbol.
 *
 * <p>All calls of one collection share a deadline of {@code signaltrader.consensus.source-timeout}
 * from submission, so the collection takes at most about one timeout regardless of how many
 * sources hang, and time spent waiting for a worker counts against it. A call still running at
 * the deadline is cancelled with an interrupt.
 * A source that times out, throws, returns no opinion or returns a malformed score
 * (no direction, confidence outside [0, 1]) is left out of this cycle's signals.
 */
@Service
public class SignalCollector {

    private static final Logger log = LoggerFactory.getLogger(SignalCollector.class);

    private final SignalSourceRegistry signalSourceRegistry;
    private final ExecutorService signalExecutor;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public SignalCollector(
            SignalSourceRegistry signalSourceRegistry,
            @Qualifier("signalExecutor") ExecutorService signalExecutor,
            TradingProperties tradingProperties,
            Clock clock) {
        this.signalSourceRegistry = signalSourceRegistry;
        this.signalExecutor = signalExecutor;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    public List<Signal> collect(String symbol, MarketContext marketContext) {
        long timeoutMs = tradingProperties.getConsensus().getSourceTimeout().toMillis();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        Map<RegisteredSource, Future<Optional<SignalScore>>> pending = new LinkedHashMap<>();
        for (RegisteredSource registered : signalSourceRegistry.getSources()) {
            try {
                pending.put(
                        registered,
                        signalExecutor.submit(() -> registered.getSource().score(symbol, marketContext)));
            } catch (RejectedExecutionException e) {
                log.warn("Signal source {} skipped for {}: worker queue full", registered.getId(), symbol);
            }
        }

        List<Signal> signals = new ArrayList<>();
        for (Map.Entry<RegisteredSource, Future<Optional<SignalScore>>> entry : pending.entrySet()) {
            String sourceId = entry.getKey().getId();
            Future<Optional<SignalScore>> future = entry.getValue();
            Optional<SignalScore> score;
            try {
                score = future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("Signal source {} timed out for {} after {}ms", sourceId, symbol, timeoutMs);
                future.cancel(true);
                continue;
            } catch (ExecutionException e) {
                log.warn("Signal source {} failed for {}: {}", sourceId, symbol, rootMessage(e));
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Signal collection for {} interrupted", symbol);
                pending.values().forEach(unfinished -> unfinished.cancel(true));
                break;
            }

            if (score == null || score.isEmpty()) {
                log.debug("Signal source {} has no opinion on {}", sourceId, symbol);
                continue;
            }
            SignalScore value = score.get();
            if (!value.isWellFormed()) {
                log.warn("Signal source {} returned malformed score for {}: {}", sourceId, symbol, value);
                continue;
            }
            signals.add(Signal.builder()
                    .sourceId(sourceId)
                    .symbol(symbol)
                    .direction(value.getDirection())
                    .confidence(value.getConfidence())
                    .timestamp(Instant.now(clock))
                    .build());
        }

        log.debug("Collected {}/{} signals for {}", signals.size(), signalSourceRegistry.size(), symbol);
        return signals;
    }

    private static String rootMessage(Throwable throwable) {
        Throwable cause = throwable.getCause() != null ? throwable.getCause() : throwable;
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
