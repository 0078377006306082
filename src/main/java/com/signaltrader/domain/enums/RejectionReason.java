package com.signaltrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-readable reasons a trade intent was refused, either by the risk manager
 * or by the execution engine after a fatal exchange error.
 *
 * <p>The lowercase code is what gets written to the ledger and exposed over the API.
 */
@Getter
@RequiredArgsConstructor
public enum RejectionReason {
    INSUFFICIENT_MARGIN("insufficient_margin"),
    LIQUIDATION_TOO_CLOSE("liquidation_too_close"),
    CIRCUIT_BREAKER_TRIPPED("circuit_breaker_tripped"),
    SYMBOL_POSITION_CAP("symbol_position_cap"),
    PORTFOLIO_POSITION_CAP("portfolio_position_cap"),
    BELOW_MIN_ORDER_SIZE("below_min_order_size"),
    LEVERAGE_CEILING_EXCEEDED("leverage_ceiling_exceeded"),
    INVALID_MARKET_PRICE("invalid_market_price"),
    EXECUTION_FAILED("execution_failed");

    private final String code;
}
