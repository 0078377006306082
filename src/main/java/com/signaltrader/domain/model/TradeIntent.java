package com.signaltrader.domain.model;

import com.signaltrader.domain.enums.Direction;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Consensus output that the risk manager turns into a sized, priced decision. Direction is never HOLD. */
@Value
@Builder
public class TradeIntent {

    String symbol;
    Direction direction;
    double aggregateConfidence;
    int contributingSignalCount;
    Instant timestamp;
}
