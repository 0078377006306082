package com.signaltrader.position;

import com.signaltrader.domain.model.Position;
import com.signaltrader.exception.ExchangeException;
import com.signaltrader.exchange.ExchangeAdapter;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic exit checks for every open position, independent of decision cycles.
 *
 * <p>Each tick first retries ledger writes left pending by earlier failures, then fetches
 * one ticker per symbol with open positions and runs the exit checks. A symbol whose price
 * cannot be fetched is skipped for this tick; the others are still checked.
 */
@Component
public class PositionMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);

    private final PositionLifecycleManager positionLifecycleManager;
    private final ExchangeAdapter exchangeAdapter;

    public PositionMonitor(PositionLifecycleManager positionLifecycleManager, ExchangeAdapter exchangeAdapter) {
        this.positionLifecycleManager = positionLifecycleManager;
        this.exchangeAdapter = exchangeAdapter;
    }

    @Scheduled(
            fixedDelayString = "${signaltrader.positions.monitor-interval-ms:10000}",
            initialDelayString = "${signaltrader.positions.monitor-interval-ms:10000}")
    public void tick() {
        if (positionLifecycleManager.getPendingWriteCount() > 0) {
            positionLifecycleManager.retryPendingLedgerWrites();
        }

        Map<String, List<Position>> bySymbol = positionLifecycleManager.getOpenPositions().stream()
                .collect(Collectors.groupingBy(Position::getSymbol));

        for (Map.Entry<String, List<Position>> entry : bySymbol.entrySet()) {
            String symbol = entry.getKey();
            BigDecimal markPrice;
            try {
                markPrice = exchangeAdapter.getTicker(symbol);
            } catch (ExchangeException e) {
                log.warn("Exit check skipped for {}: price unavailable: {}", symbol, e.getMessage());
                continue;
            }
            for (Position position : entry.getValue()) {
                try {
                    positionLifecycleManager.evaluateExit(position.getId(), markPrice);
                } catch (RuntimeException e) {
                    log.error(
                            "Exit check failed for position {} on {}: {}",
                            position.getId(),
                            symbol,
                            e.getMessage(),
                            e);
                }
            }
        }
    }
}
