package com.signaltrader.reporting;

import com.signaltrader.domain.model.Trade;
import com.signaltrader.ledger.TradeLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes trading performance from the ledger alone: win rate, profit factor, max
 * drawdown of cumulative PnL, fees, rejection rate, and per-symbol win rate.
 */
@Service
public class PerformanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCalculator.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal NO_LOSS_PROFIT_FACTOR = BigDecimal.valueOf(999.99);

    private final TradeLedger tradeLedger;

    public PerformanceCalculator(TradeLedger tradeLedger) {
        this.tradeLedger = tradeLedger;
    }

    public PerformanceReport calculate() {
        return calculate(tradeLedger.closedTrades(), tradeLedger.rejectionCount());
    }

    public PerformanceReport calculate(List<Trade> trades, long rejectionCount) {
        if (trades.isEmpty()) {
            return PerformanceReport.empty(rejectionCount);
        }

        int totalTrades = trades.size();
        List<BigDecimal> wins = trades.stream()
                .filter(Trade::isWin)
                .map(Trade::getRealizedPnl)
                .toList();
        List<BigDecimal> losses = trades.stream()
                .filter(t -> !t.isWin())
                .map(Trade::getRealizedPnl)
                .toList();

        BigDecimal grossProfit = sum(wins);
        BigDecimal grossLoss = sum(losses).abs();
        BigDecimal totalNetPnl = sum(trades.stream().map(Trade::getRealizedPnl).toList());

        BigDecimal profitFactor;
        if (grossLoss.signum() > 0) {
            profitFactor = grossProfit.divide(grossLoss, 2, RoundingMode.HALF_UP);
        } else {
            profitFactor = grossProfit.signum() > 0 ? NO_LOSS_PROFIT_FACTOR : BigDecimal.ZERO;
        }

        BigDecimal totalFees = sum(trades.stream()
                .map(Trade::getFees)
                .filter(f -> f != null)
                .toList());

        long avgHoldingMinutes = (long) trades.stream()
                .mapToLong(t -> Duration.between(t.getOpenedAt(), t.getClosedAt()).toMinutes())
                .average()
                .orElse(0);

        Map<String, BigDecimal> winRateBySymbol = trades.stream()
                .collect(Collectors.groupingBy(Trade::getSymbol, TreeMap::new, Collectors.toList()))
                .entrySet()
                .stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> percentage(e.getValue().stream().filter(Trade::isWin).count(), e.getValue().size()),
                        (a, b) -> a,
                        TreeMap::new));

        Map<String, Long> exitReasonCounts = trades.stream()
                .filter(t -> t.getExitReason() != null)
                .collect(Collectors.groupingBy(t -> t.getExitReason().name(), TreeMap::new, Collectors.counting()));

        BigDecimal winRate = percentage(wins.size(), totalTrades);
        log.debug(
                "Performance: {} trades, {}% win rate, PF={}, net={}",
                totalTrades,
                winRate,
                profitFactor,
                totalNetPnl);

        return PerformanceReport.builder()
                .totalTrades(totalTrades)
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate(winRate)
                .totalNetPnl(totalNetPnl)
                .avgPnlPerTrade(average(totalNetPnl, totalTrades))
                .avgWin(average(grossProfit, wins.size()))
                .avgLoss(average(sum(losses), losses.size()))
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .profitFactor(profitFactor)
                .maxDrawdown(maxDrawdown(trades))
                .largestWin(wins.stream().max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .largestLoss(losses.stream().min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .totalFees(totalFees)
                .avgHoldingTimeMinutes(avgHoldingMinutes)
                .rejectionCount(rejectionCount)
                .rejectionRate(percentage(rejectionCount, rejectionCount + totalTrades))
                .winRateBySymbol(winRateBySymbol)
                .exitReasonCounts(exitReasonCounts)
                .build();
    }

    /** Largest fall of cumulative PnL from its running peak, trades in close order. */
    BigDecimal maxDrawdown(List<Trade> trades) {
        BigDecimal peak = BigDecimal.ZERO;
        BigDecimal cumulative = BigDecimal.ZERO;
        BigDecimal maxDrawdown = BigDecimal.ZERO;

        List<Trade> sorted = trades.stream()
                .sorted(Comparator.comparing(Trade::getClosedAt))
                .toList();
        for (Trade trade : sorted) {
            cumulative = cumulative.add(trade.getRealizedPnl());
            peak = peak.max(cumulative);
            maxDrawdown = maxDrawdown.max(peak.subtract(cumulative));
        }
        return maxDrawdown;
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(BigDecimal total, int count) {
        return count == 0 ? BigDecimal.ZERO : total.divide(BigDecimal.valueOf(count), 8, RoundingMode.HALF_UP);
    }

    private static BigDecimal percentage(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(part)
                .divide(BigDecimal.valueOf(whole), 4, RoundingMode.HALF_UP)
                .multiply(HUNDRED);
    }
}
