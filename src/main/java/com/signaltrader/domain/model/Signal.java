package com.signaltrader.domain.model;

import com.signaltrader.domain.enums.Direction;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One source's opinion about one symbol for one decision cycle.
 * Confidence is always within [0, 1]; signals are never mutated after creation.
 */
@Value
@Builder
public class Signal {

    String sourceId;
    String symbol;
    Direction direction;
    double confidence;
    Instant timestamp;
}
