package com.signaltrader.domain.enums;

/** Why the consensus aggregator produced no trade intent for a cycle. */
public enum HoldReason {
    INSUFFICIENT_QUORUM,
    NO_SIGNALS,
    BELOW_THRESHOLD
}
