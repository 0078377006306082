package com.signaltrader.reporting;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Performance metrics over every closed trade in the ledger.
 *
 * <p>{@code winRate} and {@code rejectionRate} are percentages. {@code rejectionRate} is
 * rejections over rejections plus closed trades.
 */
@Data
@Builder
public class PerformanceReport {

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal winRate;
    private BigDecimal totalNetPnl;
    private BigDecimal avgPnlPerTrade;
    private BigDecimal avgWin;
    private BigDecimal avgLoss;
    private BigDecimal grossProfit;
    private BigDecimal grossLoss;
    private BigDecimal profitFactor;
    private BigDecimal maxDrawdown;
    private BigDecimal largestWin;
    private BigDecimal largestLoss;
    private BigDecimal totalFees;
    private long avgHoldingTimeMinutes;
    private long rejectionCount;
    private BigDecimal rejectionRate;
    private Map<String, BigDecimal> winRateBySymbol;
    private Map<String, Long> exitReasonCounts;

    public static PerformanceReport empty(long rejectionCount) {
        return PerformanceReport.builder()
                .totalTrades(0)
                .winRate(BigDecimal.ZERO)
                .totalNetPnl(BigDecimal.ZERO)
                .avgPnlPerTrade(BigDecimal.ZERO)
                .avgWin(BigDecimal.ZERO)
                .avgLoss(BigDecimal.ZERO)
                .grossProfit(BigDecimal.ZERO)
                .grossLoss(BigDecimal.ZERO)
                .profitFactor(BigDecimal.ZERO)
                .maxDrawdown(BigDecimal.ZERO)
                .largestWin(BigDecimal.ZERO)
                .largestLoss(BigDecimal.ZERO)
                .totalFees(BigDecimal.ZERO)
                .rejectionCount(rejectionCount)
                .rejectionRate(rejectionCount > 0 ? BigDecimal.valueOf(100) : BigDecimal.ZERO)
                .winRateBySymbol(Map.of())
                .exitReasonCounts(Map.of())
                .build();
    }
}
