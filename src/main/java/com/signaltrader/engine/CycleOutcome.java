package com.signaltrader.engine;

/** How one decision cycle for one symbol ended. */
public enum CycleOutcome {
    /** Consensus produced no trade intent. */
    HOLD,
    /** An open position in the intent's direction already exists. */
    ALREADY_POSITIONED,
    REJECTED,
    EXECUTED,
    EXECUTION_FAILED,
    /** Market data unavailable, trading halted or an entry already in flight. */
    SKIPPED
}
