package com.signaltrader.domain.enums;

/** Kinds of append-only records in the trade ledger. */
public enum LedgerEntryType {
    POSITION_OPENED,
    TRADE_CLOSED,
    INTENT_REJECTED,
    CIRCUIT_BREAKER_TRIPPED,
    CIRCUIT_BREAKER_RESET
}
