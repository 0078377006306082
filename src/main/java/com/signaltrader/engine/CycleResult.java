package com.signaltrader.engine;

import com.signaltrader.consensus.ConsensusResult;
import com.signaltrader.domain.enums.RejectionReason;
import com.signaltrader.domain.model.ExecutionResult;
import com.signaltrader.domain.model.Trade;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CycleResult {

    String symbol;
    CycleOutcome outcome;
    ConsensusResult consensus;
    RejectionReason rejectionReason;
    ExecutionResult execution;

    /** Trade closed in this cycle by an exit check or a signal reversal, if any. */
    Trade closedTrade;

    String detail;
}
