package com.signaltrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-symbol inputs to the risk manager.
 *
 * <p>{@code maxLeverage} is the exchange's leverage ceiling for the symbol, or null when
 * the exchange does not report one.
 */
@Value
@Builder
public class SymbolStats {

    String symbol;
    double volatility;
    double historicalWinRate;
    BigDecimal referencePrice;
    Integer maxLeverage;
}
